// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.payment;

import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.Status;
import org.easymock.EasyMockSupport;
import org.junit.*;
import pl.morgwai.base.utils.concurrent.Awaitable;
import pl.morgwai.samples.grpc.banking.*;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.getCurrentArguments;
import static org.junit.Assert.*;



public class PaymentServiceTests extends EasyMockSupport {



	/** Timeout for awaiting call finalization. */
	public static final long TIMEOUT_MILLIS = 2000L;

	/** Processing timeout of the service in timeout tests. */
	public static final long PAYMENT_TIMEOUT_MILLIS = 50L;

	static final PaymentRequest VALID_REQUEST = PaymentRequest.newBuilder()
		.setAccountId("A1")
		.setAmount(100L)
		.setCurrency("USD")
		.setDescription("test payment")
		.build();

	ExecutorService executor;
	ScheduledExecutorService timeoutScheduler;
	FakeResponseObserver<PaymentResponse> responseObserver;



	@Before
	public void setup() {
		executor = Executors.newCachedThreadPool();
		timeoutScheduler = Executors.newSingleThreadScheduledExecutor();
		responseObserver = new FakeResponseObserver<>();
	}

	@After
	public void shutdownExecutors() throws InterruptedException {
		final var failed = Awaitable.awaitMultiple(
			TIMEOUT_MILLIS,
			Awaitable.newEntry("executor", Awaitable.ofEnforcedTermination(executor)),
			Awaitable.newEntry("scheduler", Awaitable.ofEnforcedTermination(timeoutScheduler))
		);
		assertTrue("executors should terminate cleanly: " + failed, failed.isEmpty());
	}



	void processPayment(PaymentProcessor processor, long timeoutMillis, PaymentRequest request) {
		new PaymentService(processor, executor, timeoutScheduler, timeoutMillis)
			.processPayment(request, responseObserver);
	}



	@Test
	public void testApprovedPaymentIsSentOnce() throws Exception {
		final PaymentProcessor processor = mock(PaymentProcessor.class);
		final var response = PaymentResponse.newBuilder()
			.setId("p-1")
			.setStatus(SimulatedPaymentProcessor.APPROVED)
			.setAmount(100L)
			.setCurrency("USD")
			.build();
		expect(processor.process(eq(VALID_REQUEST), anyObject(BooleanSupplier.class)))
			.andAnswer(() -> {
				final var commitPermit = (BooleanSupplier) getCurrentArguments()[1];
				assertTrue("permit should be granted to a live call", commitPermit.getAsBoolean());
				return response;
			});
		replayAll();

		processPayment(processor, PAYMENT_TIMEOUT_MILLIS * 20, VALID_REQUEST);

		assertTrue("call should be finalized", responseObserver.awaitFinalization(TIMEOUT_MILLIS));
		assertEquals("call should complete with OK",
				Status.Code.OK, responseObserver.getReportedStatusCode());
		assertEquals("exactly 1 response should be sent",
				List.of(response), responseObserver.getOutputData());
		verifyAll();
	}



	@Test
	public void testInvalidRequestIsRejected() throws Exception {
		final var processor = new SimulatedPaymentProcessor(1000L);

		processPayment(processor, 0L, VALID_REQUEST.toBuilder().setAmount(-5L).build());

		assertTrue("call should be finalized", responseObserver.awaitFinalization(TIMEOUT_MILLIS));
		assertEquals("negative amount should be rejected",
				Status.Code.INVALID_ARGUMENT, responseObserver.getReportedStatusCode());
		assertTrue("nothing should be sent", responseObserver.getOutputData().isEmpty());
		assertTrue("nothing should be committed", processor.getLedger().isEmpty());
	}



	@Test
	public void testProcessingFailureIsReported() throws Exception {
		final var processor = new SimulatedPaymentProcessor(50L);

		processPayment(processor, 0L, VALID_REQUEST);

		assertTrue("call should be finalized", responseObserver.awaitFinalization(TIMEOUT_MILLIS));
		assertEquals("payment over the limit should fail",
				Status.Code.FAILED_PRECONDITION, responseObserver.getReportedStatusCode());
		assertTrue("nothing should be committed", processor.getLedger().isEmpty());
	}



	@Test
	public void testUnexpectedErrorIsReportedAsInternal() throws Exception {
		final PaymentProcessor processor = mock(PaymentProcessor.class);
		expect(processor.process(eq(VALID_REQUEST), anyObject(BooleanSupplier.class)))
			.andThrow(new IllegalStateException("backend secret"));
		replayAll();

		processPayment(processor, 0L, VALID_REQUEST);

		assertTrue("call should be finalized", responseObserver.awaitFinalization(TIMEOUT_MILLIS));
		final var status = Status.fromThrowable(responseObserver.getReportedError());
		assertEquals("unexpected errors should be reported as INTERNAL",
				Status.Code.INTERNAL, status.getCode());
		assertNull("error message should not leak to the client", status.getDescription());
		verifyAll();
	}



	@Test
	public void testTimeoutAbortsProcessingWithoutCommit() throws Exception {
		final var processor = new SimulatedPaymentProcessor(1000L, 5000L, null);

		processPayment(processor, PAYMENT_TIMEOUT_MILLIS, VALID_REQUEST);

		assertTrue("call should be finalized", responseObserver.awaitFinalization(TIMEOUT_MILLIS));
		assertEquals("slow processing should time out",
				Status.Code.DEADLINE_EXCEEDED, responseObserver.getReportedStatusCode());
		executor.shutdown();
		assertTrue("processing should be interrupted",
				executor.awaitTermination(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS));
		assertTrue("nothing should be committed", processor.getLedger().isEmpty());
		assertEquals("call should be finalized only once",
				0, responseObserver.getExtraFinalizationCount());
	}



	@Test
	public void testPermitDeniedAfterTimeout() throws Exception {
		final var permitResult = new AtomicReference<Boolean>();
		final var processingDone = new CountDownLatch(1);
		final PaymentProcessor stubbornProcessor = (request, commitPermit) -> {
			try {
				// ignores interrupts until the call is finalized by the timeout
				while ( !responseObserver.isFinalized()) Thread.onSpinWait();
				permitResult.set(commitPermit.getAsBoolean());
				if ( !permitResult.get()) throw new CancellationException("call finalized");
				return PaymentResponse.getDefaultInstance();
			} finally {
				processingDone.countDown();
			}
		};

		processPayment(stubbornProcessor, PAYMENT_TIMEOUT_MILLIS, VALID_REQUEST);

		assertTrue("processing should finish",
				processingDone.await(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS));
		assertEquals("call should time out",
				Status.Code.DEADLINE_EXCEEDED, responseObserver.getReportedStatusCode());
		assertEquals("permit should be denied after the timeout",
				Boolean.FALSE, permitResult.get());
		executor.shutdown();
		executor.awaitTermination(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
		assertEquals("no response should be sent after the timeout",
				0, responseObserver.getMessagesAfterFinalizationCount());
		assertEquals("call should be finalized only once",
				0, responseObserver.getExtraFinalizationCount());
	}



	@Test
	public void testClientCancelAbortsProcessing() throws Exception {
		final var processor = new SimulatedPaymentProcessor(1000L, 5000L, null);

		processPayment(processor, 0L, VALID_REQUEST);
		responseObserver.simulateCancel();

		executor.shutdown();
		assertTrue("processing should be interrupted",
				executor.awaitTermination(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS));
		assertFalse("cancelled call should not be finalized", responseObserver.isFinalized());
		assertTrue("nothing should be committed", processor.getLedger().isEmpty());
	}



	/**
	 * Change the below value if you need logging:<br/>
	 * <code>FINE</code> will log call finalization races.
	 */
	static Level LOG_LEVEL = Level.SEVERE;

	static final Logger log = Logger.getLogger(PaymentService.class.getName());

	@BeforeClass
	public static void setupLogging() {
		try {
			LOG_LEVEL = Level.parse(System.getProperty(
					PaymentServiceTests.class.getPackageName() + ".level"));
		} catch (Exception ignored) {}
		log.setLevel(LOG_LEVEL);
		for (final var handler: Logger.getLogger("").getHandlers()) handler.setLevel(LOG_LEVEL);
	}
}
