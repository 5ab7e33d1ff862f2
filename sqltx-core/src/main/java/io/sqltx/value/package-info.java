/**
 * Backend-agnostic classification of dynamic parameter values.
 *
 * <p>Decoded column values are always one of {@code null}, {@link java.lang.String},
 * {@link java.lang.Long}, {@link java.lang.Double} or {@link java.lang.Boolean}; parameters may
 * be any object and are classified by {@link io.sqltx.value.ValueKind#of(Object)}.
 */
package io.sqltx.value;
