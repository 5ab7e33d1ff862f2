/**
 * Handle-addressed transactions that outlive a single call.
 *
 * <p>{@link io.sqltx.tx.TransactionRegistry} maps opaque identifiers to live transactions and
 * enforces their begin-once, finish-once lifecycle. The optional
 * {@link io.sqltx.tx.TransactionReaper} rolls back transactions that were abandoned by their
 * callers.
 *
 * @see io.sqltx.tx.TransactionRegistry
 * @see io.sqltx.tx.TransactionReaper
 */
package io.sqltx.tx;
