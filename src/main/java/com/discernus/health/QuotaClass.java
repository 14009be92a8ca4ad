package com.discernus.health;

public enum QuotaClass {
    /** Published tokens/min and requests/min budget, enforced locally before sending. */
    FIXED,
    /** Server-managed pool with variable limits; handled reactively with backoff. */
    DYNAMIC_SHARED
}
