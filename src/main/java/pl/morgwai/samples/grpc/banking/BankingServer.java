// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking;

import java.io.IOException;
import java.util.concurrent.*;
import java.util.logging.Logger;

import io.grpc.Server;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.ChannelzService;
import pl.morgwai.base.utils.concurrent.Awaitable;
import pl.morgwai.base.utils.concurrent.NamingThreadFactory;
import pl.morgwai.samples.grpc.banking.chat.ChatRoom;
import pl.morgwai.samples.grpc.banking.chat.ChatService;
import pl.morgwai.samples.grpc.banking.history.*;
import pl.morgwai.samples.grpc.banking.payment.*;
import pl.morgwai.samples.grpc.banking.utils.GrpcAwaitable;



/**
 * Serves {@code PaymentService}, {@code TransactionHistoryService} and {@code ChatService} over a
 * single Netty gRPC server. Blocking work of payments and history streams runs on
 * {@link #executor}, chat sessions never block any thread.
 */
public class BankingServer {



	public static final int DEFAULT_PORT = 50051;
	public static final int DEFAULT_WORKER_THREADS = 8;
	public static final long DEFAULT_PAYMENT_TIMEOUT_MILLIS = 2000L;
	public static final long DEFAULT_PAYMENT_LIMIT = 1_000_000L;



	final Server grpcServer;
	final ThreadPoolExecutor executor;
	final ScheduledExecutorService timeoutScheduler;
	final ChatRoom chatRoom;
	final CallTrackingInterceptor callTracker;



	/**
	 * Creates and starts a server.
	 * @param port port to listen on, {@code 0} to pick an ephemeral port.
	 * @param workerThreads size of the pool processing payments and producing history streams.
	 * @param paymentTimeoutMillis processing timeout of a single payment, {@code 0} for none.
	 * @param chatQueueCapacity capacity of each chat session's outbound queue and of each of
	 *     its backlog lanes.
	 */
	public BankingServer(
		int port,
		int workerThreads,
		long paymentTimeoutMillis,
		PaymentProcessor paymentProcessor,
		TransactionSource transactionSource,
		int chatQueueCapacity
	) throws IOException {
		executor = new ThreadPoolExecutor(
			workerThreads, workerThreads, 0L, TimeUnit.DAYS, new LinkedBlockingQueue<>(),
			new NamingThreadFactory("bankingWorker")
		);
		timeoutScheduler = Executors.newSingleThreadScheduledExecutor(
				new NamingThreadFactory("paymentTimeouts"));
		chatRoom = new ChatRoom(chatQueueCapacity);
		callTracker = new CallTrackingInterceptor();
		grpcServer = NettyServerBuilder
			.forPort(port)
			.addService(new PaymentService(
					paymentProcessor, executor, timeoutScheduler, paymentTimeoutMillis))
			.addService(new TransactionHistoryService(transactionSource, executor))
			.addService(new ChatService(chatRoom))
			.addService(ChannelzService.newInstance(1024))
			.intercept(callTracker)
			.build();
		grpcServer.start();
		log.info("started on port " + grpcServer.getPort());
	}



	public int getPort() {
		return grpcServer.getPort();
	}

	public ChatRoom getChatRoom() {
		return chatRoom;
	}

	public CallTrackingInterceptor getCallTracker() {
		return callTracker;
	}



	/**
	 * Closes all chat sessions, then shuts down the server and the executors, enforcing
	 * termination of whatever does not terminate within {@code timeoutMillis} in total.
	 * @return {@code true} if everything terminated cleanly.
	 */
	public boolean shutdownAndEnforceTermination(long timeoutMillis) throws InterruptedException {
		chatRoom.shutdown();
		final var failedTerminations = Awaitable.awaitMultiple(
			timeoutMillis,
			Awaitable.newEntry("grpcServer", GrpcAwaitable.ofEnforcedTermination(grpcServer)),
			Awaitable.newEntry("executor", Awaitable.ofEnforcedTermination(executor)),
			Awaitable.newEntry(
					"timeoutScheduler", Awaitable.ofEnforcedTermination(timeoutScheduler))
		);
		for (var failedTermination: failedTerminations) {
			log.warning(failedTermination + " hasn't shutdown cleanly");
		}
		return failedTerminations.isEmpty();
	}



	/**
	 * Demo history: 3 records of account {@code "A1"}.
	 */
	static InMemoryTransactionSource newDemoTransactionSource() {
		final var source = new InMemoryTransactionSource();
		final var now = System.currentTimeMillis();
		final String[] descriptions = {"salary", "groceries", "rent"};
		final long[] amounts = {500_000L, -8_250L, -150_000L};
		for (int i = 0; i < descriptions.length; i++) {
			source.append(TransactionRecord.newBuilder()
				.setTransactionId("A1-" + (i + 1))
				.setAccountId("A1")
				.setAmount(amounts[i])
				.setCurrency("USD")
				.setDescription(descriptions[i])
				.setTimestampMillis(now - (descriptions.length - i) * 86_400_000L)
				.build());
		}
		return source;
	}



	/**
	 * Positional args, all optional: {@code port workerThreads paymentTimeoutMillis paymentLimit
	 * chatQueueCapacity}.
	 */
	public static void main(String[] args) throws Exception {
		final int port = args.length > 0 ? Integer.parseInt(args[0]) : DEFAULT_PORT;
		final int workerThreads =
				args.length > 1 ? Integer.parseInt(args[1]) : DEFAULT_WORKER_THREADS;
		final long paymentTimeoutMillis =
				args.length > 2 ? Long.parseLong(args[2]) : DEFAULT_PAYMENT_TIMEOUT_MILLIS;
		final long paymentLimit = args.length > 3 ? Long.parseLong(args[3]) : DEFAULT_PAYMENT_LIMIT;
		final int chatQueueCapacity = args.length > 4
				? Integer.parseInt(args[4]) : ChatRoom.DEFAULT_OUTBOUND_QUEUE_CAPACITY;

		final var transactionSource = newDemoTransactionSource();
		final var server = new BankingServer(
			port,
			workerThreads,
			paymentTimeoutMillis,
			new SimulatedPaymentProcessor(paymentLimit, 0L, transactionSource::recordPayment),
			transactionSource,
			chatQueueCapacity
		);

		Runtime.getRuntime().addShutdownHook(new Thread(
			() -> {
				try {
					server.shutdownAndEnforceTermination(5000L);
				} catch (InterruptedException e) {
					log.warning("shutdown interrupted");
				}
			})
		);
		server.grpcServer.awaitTermination();
	}



	static final Logger log = Logger.getLogger(BankingServer.class.getName());
}
