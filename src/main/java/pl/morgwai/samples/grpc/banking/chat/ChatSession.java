// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.chat;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import pl.morgwai.samples.grpc.banking.ChatMessage;



/**
 * A single {@code chat} call: the request observer of the call and the bounded outbound queue of
 * messages broadcast to it by other sessions of the same {@link ChatRoom}.
 * <p>
 * <b>Inbound:</b> manual flow-control, exactly 1 message is requested at a time. A received
 * message is stamped with this session's id and {@link ChatRoom#broadcast(ChatSession,
 * ChatMessage) broadcast}. The next message is requested once the current one has been handed to
 * all recipients, which never waits for any of them.</p>
 * <p>
 * <b>Outbound:</b> broadcast messages are queued up to {@link #outboundQueueCapacity} and written
 * to {@link #responseObserver} only while it is ready. When the queue is full, messages wait in
 * {@link #backlogs}: a separate lane per source session, each holding at most
 * {@link #backlogCapacity} messages. A full lane drops its oldest message, so a slow recipient
 * only ever affects the paths leading to itself. Lanes refill the queue in round-robin order,
 * preserving the order of messages within each lane.</p>
 * <p>
 * <b>Lifecycle:</b> {@link State#OPEN} &rarr; {@link State#DRAINING} (client half-closed) &rarr;
 * {@link State#CLOSED}. {@link #close(Status)} may be called in any state, from any thread and any
 * number of times: only the first call has any effect.</p>
 */
public class ChatSession implements StreamObserver<ChatMessage> {



	public enum State {

		/** Inbound messages are accepted and broadcast, broadcasts of others are delivered. */
		OPEN,

		/**
		 * The client has closed its sending side: no new messages are accepted from the client nor
		 * from other sessions. Messages still queued or backlogged are being flushed, after which
		 * the session is closed with {@link Status#OK}.
		 */
		DRAINING,

		/** The call has terminated and the session has been removed from its room. */
		CLOSED
	}



	final String id;
	final ServerCallStreamObserver<ChatMessage> responseObserver;
	final ChatRoom room;
	final int outboundQueueCapacity;
	final int backlogCapacity;

	State state = State.OPEN;  // guarded by lock
	Status closeStatus;  // guarded by lock
	final Deque<ChatMessage> outboundQueue = new ArrayDeque<>();  // guarded by lock
	/**
	 * Lanes of messages waiting for space in {@link #outboundQueue} by source session id. Guarded
	 * by {@link #lock}.
	 */
	final LinkedHashMap<String, Deque<ChatMessage>> backlogs = new LinkedHashMap<>();
	int backlogMessageCount = 0;  // guarded by lock
	long droppedMessageCount = 0L;  // guarded by lock
	final Object lock = new Object();



	ChatSession(
		String id,
		ServerCallStreamObserver<ChatMessage> responseObserver,
		ChatRoom room,
		int outboundQueueCapacity,
		int backlogCapacity
	) {
		this.id = id;
		this.responseObserver = responseObserver;
		this.room = room;
		this.outboundQueueCapacity = outboundQueueCapacity;
		this.backlogCapacity = backlogCapacity;
	}



	/**
	 * Sets up handlers and flow-control of {@link #responseObserver} and requests the first
	 * inbound message. Must be called within the {@code chat} method.
	 */
	void start() {
		responseObserver.disableAutoRequest();
		responseObserver.setOnReadyHandler(this::flush);
		responseObserver.setOnCancelHandler(this::onCancel);
		responseObserver.request(1);
		if (log.isLoggable(Level.FINE)) log.fine("session " + id + " opened");
	}



	/** Closes {@link #responseObserver} with {@code status} without ever opening the session. */
	void reject(Status status) {
		synchronized (lock) {
			state = State.CLOSED;
			closeStatus = status;
		}
		responseObserver.onError(status.asRuntimeException());
	}



	/** Stamps {@code message} and broadcasts it to the other sessions of the room. */
	@Override
	public void onNext(ChatMessage message) {
		synchronized (lock) {
			if (state != State.OPEN) {
				if (log.isLoggable(Level.FINE)) log.fine("session " + id + " not open, dropping");
				return;
			}
		}
		final var stamped = message.toBuilder()
			.setSessionId(id)
			.setSender(message.getSender().isEmpty() ? id : message.getSender())
			.setTimestampMillis(System.currentTimeMillis())
			.build();
		if (log.isLoggable(Level.FINER)) log.finer("session " + id + " received: " + stamped);
		room.broadcast(this, stamped);
	}



	/**
	 * Called when the most recent inbound message has been handed to all recipients: requests the
	 * next inbound message if still {@link State#OPEN}.
	 */
	void requestNextMessage() {
		synchronized (lock) {
			if (state != State.OPEN) return;
			responseObserver.request(1);
		}
	}



	/**
	 * Enqueues {@code message} from {@code source} for delivery to the client. If the session is
	 * not {@link State#OPEN}, the message is skipped. If the outbound queue is full or
	 * {@code source}'s lane is not empty, the message goes to the end of {@code source}'s lane,
	 * dropping the oldest one of the lane if it is full. Never blocks on the client.
	 */
	void deliver(ChatSession source, ChatMessage message) {
		synchronized (lock) {
			if (state != State.OPEN) return;
			var lane = backlogs.get(source.getId());
			if (lane == null && outboundQueue.size() < outboundQueueCapacity) {
				outboundQueue.add(message);
			} else {
				if (lane == null) {
					lane = new ArrayDeque<>();
					backlogs.put(source.getId(), lane);
				}
				if (lane.size() >= backlogCapacity) {
					lane.poll();
					backlogMessageCount--;
					droppedMessageCount++;
					if (log.isLoggable(Level.FINE)) {
						log.fine("session " + id + " lane from " + source.getId()
								+ " full, dropped the oldest message");
					}
				}
				lane.add(message);
				backlogMessageCount++;
			}
		}
		flush();
	}



	/**
	 * Moves 1 message from the lane at the head of {@link #backlogs} to {@link #outboundQueue} and
	 * rotates the lane to the tail, if it still has messages.
	 */
	void refillFromBacklog() {  // called under lock
		final var iterator = backlogs.entrySet().iterator();
		if ( !iterator.hasNext()) return;
		final var head = iterator.next();
		iterator.remove();
		outboundQueue.add(head.getValue().poll());
		backlogMessageCount--;
		if ( !head.getValue().isEmpty()) backlogs.put(head.getKey(), head.getValue());
	}



	/**
	 * Writes queued messages to {@link #responseObserver} while it is ready, refilling the queue
	 * from {@link #backlogs}. Completes a {@link State#DRAINING} session once everything is
	 * written. Also {@link ServerCallStreamObserver#setOnReadyHandler(Runnable) onReadyHandler}.
	 */
	void flush() {
		RuntimeException writeFailure = null;
		boolean drained = false;
		synchronized (lock) {
			if (state == State.CLOSED) return;
			try {
				while ( !outboundQueue.isEmpty() && responseObserver.isReady()) {
					responseObserver.onNext(outboundQueue.poll());
					refillFromBacklog();
				}
			} catch (RuntimeException e) {
				writeFailure = e;
			}
			if (writeFailure == null && state == State.DRAINING && outboundQueue.isEmpty()) {
				drained = true;
			}
		}
		if (writeFailure != null) {
			log.log(Level.WARNING, "session " + id + " failed to send a message", writeFailure);
			close(Status.fromThrowable(writeFailure));
		} else if (drained) {
			close(Status.OK);
		}
	}



	/** Client half-closed: switches to {@link State#DRAINING} and flushes the rest. */
	@Override
	public void onCompleted() {
		synchronized (lock) {
			if (state != State.OPEN) return;
			state = State.DRAINING;
		}
		if (log.isLoggable(Level.FINE)) log.fine("session " + id + " draining");
		flush();
	}



	/** Inbound stream failed. */
	@Override
	public void onError(Throwable error) {
		if (log.isLoggable(Level.FINE)) log.fine("session " + id + " inbound error: " + error);
		close(Status.fromThrowable(error));
	}



	/** {@link ServerCallStreamObserver#setOnCancelHandler(Runnable) onCancelHandler}. */
	void onCancel() {
		close(Status.CANCELLED.withDescription("client cancelled"));
	}



	/**
	 * Closes this session: removes it from its room, discards queued and backlogged messages and
	 * finalizes the call with {@code status} unless the call has
	 * been already cancelled. Idempotent: subsequent calls have no effect.
	 */
	public void close(Status status) {
		synchronized (lock) {
			if (state == State.CLOSED) return;
			state = State.CLOSED;
			closeStatus = status;
			outboundQueue.clear();
			backlogs.clear();
			backlogMessageCount = 0;
			if ( !responseObserver.isCancelled()) {
				try {
					if (status.isOk()) {
						responseObserver.onCompleted();
					} else {
						responseObserver.onError(status.asRuntimeException());
					}
				} catch (RuntimeException e) {
					if (log.isLoggable(Level.FINE)) {
						log.fine("session " + id + " could not finalize the call: " + e);
					}
				}
			}
		}
		room.remove(this);
		if (status.isOk() || status.getCode() == Status.Code.CANCELLED) {
			if (log.isLoggable(Level.FINE)) log.fine("session " + id + " closed: " + status);
		} else {
			log.info("session " + id + " closed with error: " + status);
		}
	}



	public String getId() { return id; }

	public State getState() {
		synchronized (lock) {
			return state;
		}
	}

	/** Status passed to {@link #close(Status)} or {@code null} if the session is not closed. */
	@Nullable
	public Status getCloseStatus() {
		synchronized (lock) {
			return closeStatus;
		}
	}

	public int getQueuedMessageCount() {
		synchronized (lock) {
			return outboundQueue.size();
		}
	}

	/** Number of messages waiting in all lanes of {@link #backlogs}. */
	public int getBacklogMessageCount() {
		synchronized (lock) {
			return backlogMessageCount;
		}
	}

	/** Number of messages dropped because their lane was full. */
	public long getDroppedMessageCount() {
		synchronized (lock) {
			return droppedMessageCount;
		}
	}



	@Override
	public String toString() {
		return "ChatSession { id=\"" + id + "\" }";
	}



	static final Logger log = Logger.getLogger(ChatSession.class.getName());
}
