// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.*;
import io.grpc.stub.StreamObserver;
import org.junit.*;
import pl.morgwai.samples.grpc.banking.CallTrackingInterceptor.CallKind;
import pl.morgwai.samples.grpc.banking.CallTrackingInterceptor.CallState;
import pl.morgwai.samples.grpc.banking.history.InMemoryTransactionSource;
import pl.morgwai.samples.grpc.banking.payment.SimulatedPaymentProcessor;
import pl.morgwai.samples.grpc.banking.utils.BlockingResponseObserver;
import pl.morgwai.samples.grpc.banking.utils.BlockingResponseObserver.ErrorReportedException;
import pl.morgwai.samples.grpc.banking.utils.GrpcAwaitable;

import static org.junit.Assert.*;



/** End-to-end tests over a real Netty server on an ephemeral port. */
public class BankingServerTests {



	public static final long TIMEOUT_MILLIS = 3000L;

	InMemoryTransactionSource source;
	SimulatedPaymentProcessor processor;
	BankingServer server;
	ManagedChannel channel;



	@Before
	public void setup() throws Exception {
		source = BankingServer.newDemoTransactionSource();
		processor = new SimulatedPaymentProcessor(1000L, 0L, source::recordPayment);
		server = new BankingServer(0, 4, TIMEOUT_MILLIS, processor, source, 4);
		channel = ManagedChannelBuilder
			.forTarget("localhost:" + server.getPort())
			.usePlaintext()
			.build();
	}

	@After
	public void shutdown() throws InterruptedException {
		final var channelTermination = GrpcAwaitable.ofEnforcedTermination(channel);
		if ( !channelTermination.await(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
			log.warning("channel hasn't shutdown cleanly");
		}
		assertTrue("server should shutdown cleanly",
				server.shutdownAndEnforceTermination(TIMEOUT_MILLIS));
	}



	static PaymentRequest payment(long amount, String currency) {
		return PaymentRequest.newBuilder()
			.setAccountId("A1")
			.setAmount(amount)
			.setCurrency(currency)
			.setDescription("e2e payment")
			.build();
	}

	static void awaitCondition(String message, BooleanSupplier condition)
			throws InterruptedException {
		final var deadline = System.currentTimeMillis() + TIMEOUT_MILLIS;
		while ( !condition.getAsBoolean()) {
			if (System.currentTimeMillis() > deadline) fail(message);
			Thread.sleep(5L);
		}
	}

	static Status.Code statusCodeOf(Runnable call) {
		try {
			call.run();
			fail("call should fail");
			return null;
		} catch (StatusRuntimeException e) {
			return e.getStatus().getCode();
		}
	}



	@Test
	public void testApprovedPaymentAppearsInHistory() {
		final var paymentStub = PaymentServiceGrpc.newBlockingStub(channel)
			.withDeadlineAfter(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);

		final var response = paymentStub.processPayment(payment(100L, "USD"));

		assertEquals("payment should be approved",
				SimulatedPaymentProcessor.APPROVED, response.getStatus());
		assertEquals("amount should be echoed", 100L, response.getAmount());
		assertEquals("currency should be echoed", "USD", response.getCurrency());
		assertTrue("payment should be in the ledger",
				processor.getLedger().containsKey(response.getId()));

		final var records = new ArrayList<TransactionRecord>();
		TransactionHistoryServiceGrpc.newBlockingStub(channel)
			.getTransactionHistory(
				TransactionHistoryRequest.newBuilder().setAccountId("A1").build())
			.forEachRemaining(records::add);
		assertEquals("payment should be appended to the history", 4, records.size());
		final var last = records.get(3);
		assertEquals("record id should be the payment id",
				response.getId(), last.getTransactionId());
		assertEquals("payment should be recorded as a debit", -100L, last.getAmount());
	}



	@Test
	public void testPaymentErrorsAreMappedToStatuses() {
		final var paymentStub = PaymentServiceGrpc.newBlockingStub(channel);

		assertEquals("invalid currency should be rejected",
				Status.Code.INVALID_ARGUMENT,
				statusCodeOf(() -> paymentStub.processPayment(payment(100L, "XYZ"))));
		assertEquals("payment over the limit should fail",
				Status.Code.FAILED_PRECONDITION,
				statusCodeOf(() -> paymentStub.processPayment(payment(5000L, "USD"))));
		assertTrue("nothing should be committed", processor.getLedger().isEmpty());
	}



	@Test
	public void testSlowPaymentTimesOut() throws Exception {
		final var slowProcessor = new SimulatedPaymentProcessor(1000L, TIMEOUT_MILLIS, null);
		final var slowServer = new BankingServer(0, 2, 50L, slowProcessor, source, 4);
		final var slowChannel = ManagedChannelBuilder
			.forTarget("localhost:" + slowServer.getPort())
			.usePlaintext()
			.build();
		try {
			final var paymentStub = PaymentServiceGrpc.newBlockingStub(slowChannel);
			assertEquals("slow payment should time out",
					Status.Code.DEADLINE_EXCEEDED,
					statusCodeOf(() -> paymentStub.processPayment(payment(100L, "USD"))));
			assertTrue("nothing should be committed", slowProcessor.getLedger().isEmpty());
		} finally {
			GrpcAwaitable.ofEnforcedTermination(slowChannel)
				.await(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
			slowServer.shutdownAndEnforceTermination(TIMEOUT_MILLIS);
		}
	}



	@Test
	public void testHistoryStreamedInOrder() {
		final var historyStub = TransactionHistoryServiceGrpc.newBlockingStub(channel);

		final var ids = new ArrayList<String>();
		historyStub.getTransactionHistory(
				TransactionHistoryRequest.newBuilder().setAccountId("A1").build())
			.forEachRemaining((record) -> ids.add(record.getTransactionId()));
		assertEquals("records should be streamed in stored order",
				List.of("A1-1", "A1-2", "A1-3"), ids);

		final var limited = new ArrayList<String>();
		historyStub.getTransactionHistory(
				TransactionHistoryRequest.newBuilder().setAccountId("A1").setMaxRecords(1).build())
			.forEachRemaining((record) -> limited.add(record.getTransactionId()));
		assertEquals("max_records should limit the stream", List.of("A1-1"), limited);

		final var blankAccountHistory = historyStub.getTransactionHistory(
				TransactionHistoryRequest.newBuilder().setAccountId("").build());
		assertEquals("blank account should be rejected",
				Status.Code.INVALID_ARGUMENT, statusCodeOf(blankAccountHistory::hasNext));
	}



	@Test
	public void testChatMessageReachesAllOtherParticipants() throws Exception {
		final var chatStub = ChatServiceGrpc.newStub(channel);
		final var received = new CountDownLatch(2);
		final List<List<ChatMessage>> inboxes = new ArrayList<>();
		final List<BlockingResponseObserver<ChatMessage, ChatMessage>> responseObservers =
				new ArrayList<>();
		final List<StreamObserver<ChatMessage>> requestObservers = new ArrayList<>();
		for (int i = 0; i < 3; i++) {
			final List<ChatMessage> inbox = Collections.synchronizedList(new ArrayList<>());
			inboxes.add(inbox);
			final var responseObserver = new BlockingResponseObserver<ChatMessage, ChatMessage>(
				(message) -> {
					inbox.add(message);
					received.countDown();
				}
			);
			responseObservers.add(responseObserver);
			requestObservers.add(chatStub.chat(responseObserver));
		}
		awaitCondition("all sessions should be admitted",
				() -> server.getChatRoom().getSessionCount() == 3);
		assertEquals("chat calls should be tracked as active bidi streams",
				3, server.getCallTracker().getActiveCalls(CallKind.BIDI_STREAM).size());

		requestObservers.get(0).onNext(
				ChatMessage.newBuilder().setSender("S1").setText("hello").build());
		assertTrue("other participants should receive the message",
				received.await(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS));
		for (var requestObserver: requestObservers) requestObserver.onCompleted();
		for (var responseObserver: responseObservers) {
			assertTrue("chat should complete after half-close",
					responseObserver.awaitCompletion(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS));
		}

		assertTrue("sender should not receive its own message", inboxes.get(0).isEmpty());
		for (var inbox: inboxes.subList(1, 3)) {
			assertEquals("each other participant should get exactly 1 message", 1, inbox.size());
			assertEquals("text should be delivered", "hello", inbox.get(0).getText());
			assertEquals("sender should be delivered", "S1", inbox.get(0).getSender());
			assertFalse("session id should be stamped", inbox.get(0).getSessionId().isEmpty());
		}
		awaitCondition("all sessions should be removed",
				() -> server.getChatRoom().getSessionCount() == 0);
	}



	@Test
	public void testShutdownClosesChatWithUnavailable() throws Exception {
		final var responseObserver =
				new BlockingResponseObserver<ChatMessage, ChatMessage>((message) -> {});
		ChatServiceGrpc.newStub(channel).chat(responseObserver);
		awaitCondition("session should be admitted",
				() -> server.getChatRoom().getSessionCount() == 1);

		server.getChatRoom().shutdown();

		try {
			responseObserver.awaitCompletion(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
			fail("chat should end with an error");
		} catch (ErrorReportedException e) {
			assertEquals("chat should be closed with UNAVAILABLE",
					Status.Code.UNAVAILABLE, e.getStatus().getCode());
		}
	}



	@Test
	public void testCallsAreTrackedUntilTerminated() throws Exception {
		final var tracker = server.getCallTracker();
		final var paymentStub = PaymentServiceGrpc.newBlockingStub(channel);

		paymentStub.processPayment(payment(10L, "EUR"));
		statusCodeOf(() -> paymentStub.processPayment(payment(-10L, "EUR")));

		awaitCondition("completed call should be counted",
				() -> tracker.getTerminatedCallCount(CallState.COMPLETED) == 1);
		awaitCondition("failed call should be counted",
				() -> tracker.getTerminatedCallCount(CallState.FAILED) == 1);
		assertTrue("no unary call should remain active",
				tracker.getActiveCalls(CallKind.UNARY).isEmpty());
		try {
			tracker.getTerminatedCallCount(CallState.ACTIVE);
			fail("IllegalArgumentException expected");
		} catch (IllegalArgumentException expected) {}
	}



	/**
	 * Change the below value if you need logging:<br/>
	 * <code>FINE</code> will log call and session lifecycle events.
	 */
	static Level LOG_LEVEL = Level.WARNING;

	static final Logger log = Logger.getLogger(BankingServer.class.getPackageName());

	@BeforeClass
	public static void setupLogging() {
		try {
			LOG_LEVEL = Level.parse(System.getProperty(
					BankingServerTests.class.getPackageName() + ".level"));
		} catch (Exception ignored) {}
		log.setLevel(LOG_LEVEL);
		for (final var handler: Logger.getLogger("").getHandlers()) handler.setLevel(LOG_LEVEL);
	}
}
