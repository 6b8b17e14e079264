// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.history;



/**
 * External data source of transaction histories, read-only from the service's perspective.
 */
public interface TransactionSource {

	/**
	 * Opens a cursor over the history of {@code accountId} in its stored order. Each call starts
	 * from scratch. Unknown accounts yield an empty cursor. May block, so it is always called on
	 * a worker thread.
	 */
	TransactionCursor openHistory(String accountId) throws TransactionSourceException;
}
