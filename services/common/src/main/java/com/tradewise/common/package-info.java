/**
 * Shared domain types, error model, event and metrics sinks for TradeWise services.
 *
 * Parameters, return values and fields are assumed to be @NonNull unless
 * explicitly annotated with @Nullable.
 */
@NonNullApi
@NonNullFields
package com.tradewise.common;

import org.springframework.lang.NonNullApi;
import org.springframework.lang.NonNullFields;
