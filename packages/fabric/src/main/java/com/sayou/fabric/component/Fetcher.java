package com.sayou.fabric.component;

/**
 * Retrieves the raw payload behind an identifier. Returning {@link RawPayload#empty(String)}
 * means there was nothing to fetch.
 */
public interface Fetcher extends Component<String, RawPayload> {
  default RawPayload fetch(String identifier) {
    return execute(identifier);
  }
}
