package com.github.spud.apply.orchestrator.application.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables for the session orchestrator
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

  private final Registry registry = new Registry();
  private final Broadcast broadcast = new Broadcast();
  private final Sweep sweep = new Sweep();
  private final Ingestion ingestion = new Ingestion();
  private final ReviewGate reviewGate = new ReviewGate();
  private final Screenshots screenshots = new Screenshots();
  private final Focus focus = new Focus();

  @Getter
  @Setter
  public static class Registry {

    /**
     * Number of lock shards guarding the session table.
     * Sessions hash onto a shard; transitions on one shard never wait on another.
     * Default: 64
     */
    private int shards = 64;
  }

  @Getter
  @Setter
  public static class Broadcast {

    /**
     * Outbound queue size per live subscriber.
     * A subscriber whose queue fills up is dropped with SUBSCRIBER_OVERFLOW.
     * Default: 256
     */
    private int subscriberQueueCapacity = 256;

    /**
     * How long live streams stay open after their session turns terminal, so that the final
     * events appended by the terminating call still reach subscribers
     */
    private Duration terminalGrace = Duration.ofSeconds(5);
  }

  @Getter
  @Setter
  public static class Sweep {

    private boolean enabled = true;

    /**
     * A running session with no ingestion for this long is failed with a timeout detail
     */
    private Duration staleAfter = Duration.ofMinutes(10);

    /**
     * Delay between two sweeps
     */
    private Duration interval = Duration.ofSeconds(30);
  }

  @Getter
  @Setter
  public static class Ingestion {

    /**
     * What an ingested error event does to the session when it is not marked fatal
     */
    private ErrorPolicy errorPolicy = ErrorPolicy.PAUSE;
  }

  @Getter
  @Setter
  public static class ReviewGate {

    /**
     * Pause a running session when the agent clicks an element that looks like final submission
     */
    private boolean enabled = false;

    private List<String> keywords = new ArrayList<>(
      List.of("submit", "apply", "send application"));
  }

  @Getter
  @Setter
  public static class Screenshots {

    /**
     * Root under which per-session screenshot directories are assigned
     */
    private String baseDir = "data/applications";
  }

  @Getter
  @Setter
  public static class Focus {

    /**
     * Base URL of the remote browser viewer handed out by the focus endpoint, empty when none
     */
    private String viewerUrl = "";
  }

  public enum ErrorPolicy {
    /**
     * Pause the session and wait for an operator
     */
    PAUSE,

    /**
     * Fail the session with the error as detail
     */
    FAIL,

    /**
     * Only record the event
     */
    RECORD
  }
}
