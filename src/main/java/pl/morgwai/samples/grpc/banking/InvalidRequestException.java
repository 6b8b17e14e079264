// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking;



/**
 * Thrown when a request is malformed or unacceptable. Such requests are never retried by the
 * server. Reported to clients as {@link io.grpc.Status#INVALID_ARGUMENT}.
 */
public class InvalidRequestException extends Exception {

	public InvalidRequestException(String message) { super(message); }

	private static final long serialVersionUID = 4027384557815062219L;
}
