// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;
import pl.morgwai.samples.grpc.banking.utils.BlockingResponseObserver;
import pl.morgwai.samples.grpc.banking.utils.BlockingResponseObserver.ErrorReportedException;
import pl.morgwai.samples.grpc.banking.utils.GrpcAwaitable;



/**
 * Makes a sample payment, prints the resulting transaction history of the account and then
 * relays lines from the standard input to the chat until EOF.
 * <p>
 * Positional args, all optional: {@code target accountId sender}.</p>
 */
public class BankingClient {



	public static void main(String[] args) throws Exception {
		final var target = args.length > 0 ? args[0] : "localhost:" + BankingServer.DEFAULT_PORT;
		final var accountId = args.length > 1 ? args[1] : "A1";
		final var sender = args.length > 2 ? args[2] : System.getProperty("user.name", "");

		final var channel = ManagedChannelBuilder
			.forTarget(target)
			.usePlaintext()
			.build();
		try {
			final var paymentStub = PaymentServiceGrpc.newBlockingStub(channel);
			try {
				final var payment = paymentStub
					.withDeadlineAfter(5, TimeUnit.SECONDS)
					.processPayment(PaymentRequest.newBuilder()
						.setAccountId(accountId)
						.setAmount(100L)
						.setCurrency("USD")
						.setDescription("sample payment")
						.build());
				System.out.println(
						"CLIENT: payment " + payment.getId() + " " + payment.getStatus());
			} catch (StatusRuntimeException e) {
				System.out.println("CLIENT: payment failed: " + e.getStatus());
			}

			final var historyStub = TransactionHistoryServiceGrpc.newBlockingStub(channel);
			try {
				final var history = historyStub.getTransactionHistory(
						TransactionHistoryRequest.newBuilder().setAccountId(accountId).build());
				while (history.hasNext()) {
					final var record = history.next();
					System.out.println("CLIENT: " + record.getTransactionId() + "  "
							+ record.getAmount() + " " + record.getCurrency() + "  "
							+ record.getDescription());
				}
			} catch (StatusRuntimeException e) {
				System.out.println("CLIENT: history failed: " + e.getStatus());
			}

			chat(ChatServiceGrpc.newStub(channel), sender);
		} finally {
			if ( !GrpcAwaitable.ofEnforcedTermination(channel).await(5, TimeUnit.SECONDS)) {
				System.out.println("CLIENT: channel hasn't shutdown cleanly");
			}
		}
	}



	static void chat(ChatServiceGrpc.ChatServiceStub chatStub, String sender)
			throws Exception {
		final var responseObserver = new BlockingResponseObserver<ChatMessage, ChatMessage>(
				(message) -> System.out.println(message.getSender() + ": " + message.getText()));
		final var requestObserver = chatStub.chat(responseObserver);
		System.out.println("CLIENT: chat started, EOF to leave");
		final var input =
				new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
		String line;
		while ((line = input.readLine()) != null && !responseObserver.isCompleted()) {
			requestObserver.onNext(ChatMessage.newBuilder()
				.setSender(sender)
				.setText(line)
				.build());
		}
		requestObserver.onCompleted();
		try {
			if ( !responseObserver.awaitCompletion(5, TimeUnit.SECONDS)) {
				System.out.println("CLIENT: chat hasn't completed in time");
			}
		} catch (ErrorReportedException e) {
			System.out.println("CLIENT: chat ended with " + e.getStatus());
		}
	}
}
