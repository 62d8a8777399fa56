package com.axiom.gateway.api.dto;

import jakarta.validation.constraints.Size;

/** Optional overrides for the successor; absent fields keep the prior version's values. */
public record SupersedeRequest(@Size(max = 10_000) String rawIntent, String language) {
}
