// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.utils;

import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

import io.grpc.ManagedChannel;
import io.grpc.Server;
import pl.morgwai.base.utils.concurrent.Awaitable;



/**
 * {@link Awaitable}s of gRPC objects' terminations, usually combined with other resources'
 * terminations using {@code Awaitable.awaitMultiple(...)}.
 */
public interface GrpcAwaitable {



	/**
	 * Shuts down {@code server} and awaits its termination. If it fails to terminate in time, the
	 * remaining calls are cancelled with {@link Server#shutdownNow()}.
	 */
	static Awaitable.WithUnit ofEnforcedTermination(Server server) {
		return ofEnforcedShutdown(
			"server " + server,
			server::shutdown,
			server::awaitTermination,
			server::isTerminated,
			server::shutdownNow
		);
	}



	/**
	 * Shuts down {@code channel} and awaits its termination. If it fails to terminate in time, the
	 * remaining calls are cancelled with {@link ManagedChannel#shutdownNow()}.
	 */
	static Awaitable.WithUnit ofEnforcedTermination(ManagedChannel channel) {
		return ofEnforcedShutdown(
			"channel " + channel,
			channel::shutdown,
			channel::awaitTermination,
			channel::isTerminated,
			channel::shutdownNow
		);
	}



	private static Awaitable.WithUnit ofEnforcedShutdown(
		String label,
		Runnable shutdown,
		Awaitable.WithUnit termination,
		BooleanSupplier isTerminated,
		Runnable shutdownNow
	) {
		return (timeout, unit) -> {
			try {
				shutdown.run();
				return termination.await(timeout, unit);
			} finally {
				if ( !isTerminated.getAsBoolean()) {
					Logger.getLogger(GrpcAwaitable.class.getName()).warning(
							"enforcing termination of " + label);
					shutdownNow.run();
				}
			}
		};
	}
}
