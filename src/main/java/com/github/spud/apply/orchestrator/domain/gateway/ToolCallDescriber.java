package com.github.spud.apply.orchestrator.domain.gateway;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Turns a browser tool invocation into the one-line step shown to operators.
 */
@Component
public class ToolCallDescriber {

  private final Map<String, Function<Map<?, ?>, String>> templates = new HashMap<>();

  public ToolCallDescriber() {
    templates.put("browser_navigate", args -> "Navigating to " + arg(args, "url", "page"));
    templates.put("browser_click", args -> "Clicking " + arg(args, "element", "element"));
    templates.put("browser_type", args -> "Typing into " + arg(args, "element", "field"));
    templates.put("browser_fill_form",
      args -> "Filling form with " + countOf(args.get("fields")) + " fields");
    templates.put("browser_file_upload", args -> "Uploading file");
    templates.put("browser_select_option",
      args -> "Selecting option in " + arg(args, "element", "dropdown"));
    templates.put("browser_wait_for", args -> "Waiting for page to load");
    templates.put("browser_snapshot", args -> "Analyzing page content");
    templates.put("get_page_state", args -> "Analyzing page structure");
    templates.put("browser_press_key", args -> "Pressing " + arg(args, "key", "key"));
    templates.put("browser_hover", args -> "Hovering over " + arg(args, "element", "element"));
    templates.put("browser_drag", args -> "Dragging element");
    templates.put("browser_handle_dialog", args -> "Handling dialog");
    templates.put("browser_evaluate", args -> "Executing JavaScript");
    templates.put("browser_run_code", args -> "Running custom browser code");
    templates.put("browser_take_screenshot", args -> "Taking screenshot");
    templates.put("browser_console_messages", args -> "Reading console messages");
    templates.put("browser_network_requests", args -> "Analyzing network requests");
    templates.put("browser_resize", args -> "Resizing browser window");
    templates.put("browser_tabs", args -> "Managing browser tabs");
    templates.put("browser_navigate_back", args -> "Going back to previous page");
  }

  public String describe(String tool, Map<?, ?> arguments) {
    Function<Map<?, ?>, String> template = templates.get(tool);
    if (template == null) {
      return "Executing " + tool;
    }
    return template.apply(arguments != null ? arguments : Collections.emptyMap());
  }

  private static String arg(Map<?, ?> args, String key, String fallback) {
    Object value = args.get(key);
    return value != null && !value.toString().isBlank() ? value.toString() : fallback;
  }

  private static int countOf(Object value) {
    if (value instanceof Collection<?> collection) {
      return collection.size();
    }
    if (value instanceof Map<?, ?> map) {
      return map.size();
    }
    return 0;
  }
}
