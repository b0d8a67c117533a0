package io.b2mash.b2b.datasync.integration;

/**
 * Why the last sync of an integration failed, which determines what the tenant has to do about
 * it.
 */
public enum ErrorCategory {
  /** Credentials are no longer accepted; the tenant must run the OAuth handshake again. */
  RECONNECT_REQUIRED,
  /** Provider outage or throttling; the next scheduled or manual sync may succeed. */
  TRANSIENT,
  /** The provider rejected the request or returned data that cannot be processed. */
  PERMANENT,
  /** The job ran out of its time budget, usually while waiting for rate-limit windows. */
  TIMEOUT
}
