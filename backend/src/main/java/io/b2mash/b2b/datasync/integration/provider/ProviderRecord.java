package io.b2mash.b2b.datasync.integration.provider;

import java.util.Map;

/** One record pulled from a provider, e.g. an order or an invoice, as a JSON-like map. */
public record ProviderRecord(String recordType, String externalId, Map<String, Object> payload) {}
