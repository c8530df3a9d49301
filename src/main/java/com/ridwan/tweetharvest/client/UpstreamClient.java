package com.ridwan.tweetharvest.client;

/** Entry point to the authenticated tweet source. */
public interface UpstreamClient {

  /**
   * Opens an authenticated session. Credential problems surface as exceptions that classify as
   * authentication failures.
   */
  UpstreamSession authenticate();
}
