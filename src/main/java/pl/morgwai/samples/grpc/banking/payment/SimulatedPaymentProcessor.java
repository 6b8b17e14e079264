// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.payment;

import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import pl.morgwai.samples.grpc.banking.*;



/**
 * {@link PaymentProcessor} that approves every valid payment up to {@link #paymentLimit} after an
 * optional artificial latency and records approved payments in an in-memory ledger.
 */
public class SimulatedPaymentProcessor implements PaymentProcessor {



	public static final String APPROVED = "approved";
	public static final Set<String> SUPPORTED_CURRENCIES =
			Set.of("USD", "EUR", "GBP", "PLN", "CHF", "JPY");
	public static final int MAX_DESCRIPTION_LENGTH = 256;



	final long paymentLimit;
	final long processingMillis;
	final BiConsumer<? super PaymentRequest, ? super PaymentResponse> approvalListener;

	final Map<String, PaymentResponse> ledger = new ConcurrentHashMap<>();



	/**
	 * @param paymentLimit maximum amount of a single payment. Larger payments fail with
	 *     {@link ProcessingFailureException}.
	 * @param processingMillis simulated latency of the payment backend.
	 * @param approvalListener notified synchronously after each approved payment, may be
	 *     {@code null}.
	 */
	public SimulatedPaymentProcessor(
		long paymentLimit,
		long processingMillis,
		BiConsumer<? super PaymentRequest, ? super PaymentResponse> approvalListener
	) {
		this.paymentLimit = paymentLimit;
		this.processingMillis = processingMillis;
		this.approvalListener = approvalListener;
	}

	public SimulatedPaymentProcessor(long paymentLimit) {
		this(paymentLimit, 0L, null);
	}



	@Override
	public PaymentResponse process(PaymentRequest request, BooleanSupplier commitPermit)
			throws InvalidRequestException, ProcessingFailureException, InterruptedException {
		validate(request);
		if (request.getAmount() > paymentLimit) {
			throw new ProcessingFailureException("amount " + request.getAmount()
					+ " exceeds the single payment limit of " + paymentLimit);
		}
		if (processingMillis > 0L) Thread.sleep(processingMillis);
		if (Thread.interrupted()) throw new InterruptedException();

		if ( !commitPermit.getAsBoolean()) {
			throw new CancellationException("payment call already finalized");
		}
		final var response = PaymentResponse.newBuilder()
			.setId(UUID.randomUUID().toString())
			.setStatus(APPROVED)
			.setAmount(request.getAmount())
			.setCurrency(request.getCurrency())
			.setProcessedAtMillis(System.currentTimeMillis())
			.build();
		ledger.put(response.getId(), response);
		if (log.isLoggable(Level.FINE)) {
			log.fine("approved payment " + response.getId() + " of " + request.getAmount() + ' '
					+ request.getCurrency());
		}
		if (approvalListener != null) approvalListener.accept(request, response);
		return response;
	}



	static void validate(PaymentRequest request) throws InvalidRequestException {
		if (request.getAmount() <= 0L) {
			throw new InvalidRequestException("amount must be positive");
		}
		final var currency = request.getCurrency();
		if (currency.length() != 3 || !currency.chars().allMatch(c -> c >= 'A' && c <= 'Z')) {
			throw new InvalidRequestException("malformed currency code: \"" + currency + '"');
		}
		if ( !SUPPORTED_CURRENCIES.contains(currency)) {
			throw new InvalidRequestException("unsupported currency: " + currency);
		}
		if (request.getDescription().length() > MAX_DESCRIPTION_LENGTH) {
			throw new InvalidRequestException(
					"description longer than " + MAX_DESCRIPTION_LENGTH + " characters");
		}
	}



	/** Approved payments by their ids. */
	public Map<String, PaymentResponse> getLedger() {
		return Collections.unmodifiableMap(ledger);
	}



	static final Logger log = Logger.getLogger(SimulatedPaymentProcessor.class.getName());
}
