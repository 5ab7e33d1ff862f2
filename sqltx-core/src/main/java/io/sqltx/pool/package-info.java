/**
 * Registry of open connection pools keyed by connection URL.
 *
 * @see io.sqltx.pool.PoolRegistry
 */
package io.sqltx.pool;
