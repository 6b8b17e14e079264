// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.payment;

import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import pl.morgwai.samples.grpc.banking.*;



/**
 * Domain logic of {@link PaymentService}. Called once per call on a worker thread, never retried.
 */
public interface PaymentProcessor {



	/**
	 * Validates and executes the payment described by {@code request}.
	 * <p>
	 * Right before performing its externally observable action (the actual payment attempt), an
	 * implementation must call {@code commitPermit.getAsBoolean()}. If it returns {@code false},
	 * the call has already been finalized (timed out or cancelled) and the implementation must
	 * return without any side effect by throwing a {@link CancellationException}. Validation and
	 * any other side-effect-free work should happen before obtaining the permit.</p>
	 * <p>
	 * Implementations should be responsive to interrupts: the processing thread is interrupted
	 * when the call is finalized before the permit was obtained.</p>
	 * @throws InvalidRequestException if {@code request} is malformed or unacceptable.
	 * @throws ProcessingFailureException if a valid payment could not be executed.
	 */
	PaymentResponse process(PaymentRequest request, BooleanSupplier commitPermit)
			throws InvalidRequestException, ProcessingFailureException, InterruptedException;
}
