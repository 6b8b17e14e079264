// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking;



/**
 * Domain-level failure of a valid request, for example a payment above the allowed limit.
 * Reported to clients as {@link io.grpc.Status#FAILED_PRECONDITION}.
 */
public class ProcessingFailureException extends Exception {

	public ProcessingFailureException(String message) { super(message); }

	public ProcessingFailureException(String message, Throwable cause) { super(message, cause); }

	private static final long serialVersionUID = -2254914032478190731L;
}
