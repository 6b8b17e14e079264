// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import io.grpc.*;
import io.grpc.ForwardingServerCall.SimpleForwardingServerCall;
import io.grpc.ForwardingServerCallListener.SimpleForwardingServerCallListener;



/**
 * Tracks every call accepted by the server: its {@link CallKind kind} and
 * {@link CallState lifecycle state}. Calls are kept in {@link #getActiveCalls() the active set}
 * from admission until they reach a terminal state, after which only per-state counters remain.
 */
public class CallTrackingInterceptor implements ServerInterceptor {



	public enum CallKind {

		UNARY, CLIENT_STREAM, SERVER_STREAM, BIDI_STREAM;

		public static CallKind of(MethodDescriptor.MethodType methodType) {
			switch (methodType) {
				case UNARY: return UNARY;
				case CLIENT_STREAMING: return CLIENT_STREAM;
				case SERVER_STREAMING: return SERVER_STREAM;
				default: return BIDI_STREAM;
			}
		}
	}



	public enum CallState {

		PENDING, ACTIVE, COMPLETED, FAILED, CANCELLED;

		public boolean isTerminal() {
			return this == COMPLETED || this == FAILED || this == CANCELLED;
		}
	}



	public static class TrackedCall {

		final long id;
		final String fullMethodName;
		final CallKind kind;
		CallState state = CallState.PENDING;  // guarded by this

		TrackedCall(long id, String fullMethodName, CallKind kind) {
			this.id = id;
			this.fullMethodName = fullMethodName;
			this.kind = kind;
		}

		public long getId() { return id; }
		public String getFullMethodName() { return fullMethodName; }
		public CallKind getKind() { return kind; }
		public synchronized CallState getState() { return state; }

		/** Moves to {@code newState} unless already terminal or {@code newState} is not later. */
		synchronized boolean transition(CallState newState) {
			if (state.isTerminal() || newState.ordinal() <= state.ordinal()) return false;
			state = newState;
			return true;
		}

		@Override public String toString() {
			return "TrackedCall { id=" + id + ", method=\"" + fullMethodName + "\", kind=" + kind
					+ " }";
		}
	}



	final Map<Long, TrackedCall> activeCalls = new ConcurrentHashMap<>();
	final AtomicLong idSequence = new AtomicLong(0L);
	final Map<CallState, AtomicLong> terminatedCallCounters = new EnumMap<>(CallState.class);

	public CallTrackingInterceptor() {
		for (var state: CallState.values()) {
			if (state.isTerminal()) terminatedCallCounters.put(state, new AtomicLong(0L));
		}
	}



	@Override
	public <RequestT, ResponseT> ServerCall.Listener<RequestT> interceptCall(
		ServerCall<RequestT, ResponseT> call,
		Metadata headers,
		ServerCallHandler<RequestT, ResponseT> next
	) {
		final var method = call.getMethodDescriptor();
		final var trackedCall = new TrackedCall(
			idSequence.incrementAndGet(),
			method.getFullMethodName(),
			CallKind.of(method.getType())
		);
		activeCalls.put(trackedCall.id, trackedCall);
		if (log.isLoggable(Level.FINE)) log.fine("admitted " + trackedCall);

		final var trackingCall = new SimpleForwardingServerCall<RequestT, ResponseT>(call) {
			@Override public void close(Status status, Metadata trailers) {
				terminate(
					trackedCall,
					status.isOk() ? CallState.COMPLETED
						: status.getCode() == Status.Code.CANCELLED ? CallState.CANCELLED
						: CallState.FAILED
				);
				super.close(status, trailers);
			}
		};
		final ServerCall.Listener<RequestT> listener;
		try {
			listener = next.startCall(trackingCall, headers);
		} catch (RuntimeException e) {
			terminate(trackedCall, CallState.FAILED);
			throw e;
		}
		trackedCall.transition(CallState.ACTIVE);

		return new SimpleForwardingServerCallListener<RequestT>(listener) {
			@Override public void onCancel() {
				terminate(trackedCall, CallState.CANCELLED);
				super.onCancel();
			}
		};
	}



	void terminate(TrackedCall trackedCall, CallState terminalState) {
		if ( !trackedCall.transition(terminalState)) return;
		activeCalls.remove(trackedCall.id);
		terminatedCallCounters.get(terminalState).incrementAndGet();
		if (log.isLoggable(Level.FINE)) log.fine(trackedCall + " " + terminalState);
	}



	public List<TrackedCall> getActiveCalls() {
		return List.copyOf(activeCalls.values());
	}

	public List<TrackedCall> getActiveCalls(CallKind kind) {
		return activeCalls.values().stream()
			.filter((trackedCall) -> trackedCall.kind == kind)
			.collect(Collectors.toUnmodifiableList());
	}

	/** Number of calls that have reached {@code terminalState} so far. */
	public long getTerminatedCallCount(CallState terminalState) {
		if ( !terminalState.isTerminal()) {
			throw new IllegalArgumentException(terminalState + " is not terminal");
		}
		return terminatedCallCounters.get(terminalState).get();
	}



	static final Logger log = Logger.getLogger(CallTrackingInterceptor.class.getName());
}
