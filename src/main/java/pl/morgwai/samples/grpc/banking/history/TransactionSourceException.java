// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.history;



/**
 * Failure of a {@link TransactionSource} either when opening a cursor or in the middle of
 * iterating it. Terminates the given history stream with {@link io.grpc.Status#UNAVAILABLE}.
 */
public class TransactionSourceException extends Exception {

	public TransactionSourceException(String message) { super(message); }

	public TransactionSourceException(String message, Throwable cause) { super(message, cause); }

	private static final long serialVersionUID = 6158310263339012675L;
}
