/**
 * Shared utilities: the dependency-free {@link io.sqltx.util.JsonCodec} used for the
 * text fallback of non-scalar parameters.
 */
package io.sqltx.util;
