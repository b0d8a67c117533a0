package io.b2mash.b2b.datasync.tenant;

public enum SubscriptionTier {
  STARTER,
  PRO,
  ENTERPRISE
}
