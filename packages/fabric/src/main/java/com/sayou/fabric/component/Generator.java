package com.sayou.fabric.component;

import java.util.List;

/** Discovers further identifiers from a fetched payload (links, pages, cursors). */
public interface Generator extends Component<RawPayload, List<String>> {
  default List<String> generate(RawPayload payload) {
    return execute(payload);
  }
}
