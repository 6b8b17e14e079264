// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.chat;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import pl.morgwai.samples.grpc.banking.ChatMessage;



/**
 * Registry of {@link ChatSession}s and the broadcast logic between them.
 * The registry is the only state shared between sessions: all its mutations happen under
 * {@link #lock} and broadcasts iterate over a snapshot taken under it.
 * <p>
 * Messages accepted from a given session are delivered to each other {@link ChatSession.State#OPEN
 * open} session in the order they were accepted. There is no ordering between messages from
 * different sessions.</p>
 * <p>
 * Backpressure: each recipient holds messages that do not fit into its outbound queue in a
 * separate bounded lane per source session (see {@link ChatSession}). A slow recipient therefore
 * never delays delivery to the others nor the source's next inbound message: only its own lanes
 * fill up, dropping their oldest messages when full. No thread is ever blocked.</p>
 */
public class ChatRoom {



	public static final int DEFAULT_OUTBOUND_QUEUE_CAPACITY = 32;



	final int outboundQueueCapacity;
	final int backlogCapacity;

	final Map<String, ChatSession> sessions = new LinkedHashMap<>();  // guarded by lock
	boolean shutDown = false;  // guarded by lock
	final Object lock = new Object();



	/**
	 * @param outboundQueueCapacity capacity of each session's outbound queue.
	 * @param backlogCapacity capacity of each lane between a source session and a recipient whose
	 *     outbound queue is full.
	 */
	public ChatRoom(int outboundQueueCapacity, int backlogCapacity) {
		if (outboundQueueCapacity < 1) {
			throw new IllegalArgumentException("outboundQueueCapacity must be positive");
		}
		if (backlogCapacity < 1) {
			throw new IllegalArgumentException("backlogCapacity must be positive");
		}
		this.outboundQueueCapacity = outboundQueueCapacity;
		this.backlogCapacity = backlogCapacity;
	}

	/** Uses {@code outboundQueueCapacity} also as {@code backlogCapacity}. */
	public ChatRoom(int outboundQueueCapacity) {
		this(outboundQueueCapacity, outboundQueueCapacity);
	}

	public ChatRoom() { this(DEFAULT_OUTBOUND_QUEUE_CAPACITY); }



	/**
	 * Creates a new session for a {@code chat} call and registers it. If this room has been
	 * {@link #shutdown() shut down}, the call is rejected with {@link Status#UNAVAILABLE} instead.
	 * Must be called within the {@code chat} method that received {@code responseObserver}.
	 * @return request observer for the call.
	 */
	public ChatSession admit(ServerCallStreamObserver<ChatMessage> responseObserver) {
		final var session = new ChatSession(
				UUID.randomUUID().toString(),
				responseObserver,
				this,
				outboundQueueCapacity,
				backlogCapacity);
		synchronized (lock) {
			if ( !shutDown) {
				sessions.put(session.getId(), session);
				session.start();
				return session;
			}
		}
		log.fine("room shut down, rejecting new session");
		session.reject(Status.UNAVAILABLE.withDescription("chat is shutting down"));
		return session;
	}



	/**
	 * Delivers {@code message} to all other sessions and then lets {@code source}
	 * {@link ChatSession#requestNextMessage() request its next message}.
	 */
	void broadcast(ChatSession source, ChatMessage message) {
		final List<ChatSession> recipients;
		synchronized (lock) {
			recipients = new ArrayList<>(sessions.values());
		}
		recipients.remove(source);
		if (log.isLoggable(Level.FINER)) {
			log.finer("broadcasting from " + source.getId() + " to " + recipients.size());
		}
		for (var recipient: recipients) recipient.deliver(source, message);
		source.requestNextMessage();
	}



	/** Removes {@code session} from the registry. Called by {@link ChatSession#close(Status)}. */
	void remove(ChatSession session) {
		synchronized (lock) {
			sessions.remove(session.getId(), session);
		}
	}



	/**
	 * Rejects all further admissions and closes all registered sessions with
	 * {@link Status#UNAVAILABLE}.
	 */
	public void shutdown() {
		final List<ChatSession> remaining;
		synchronized (lock) {
			shutDown = true;
			remaining = new ArrayList<>(sessions.values());
		}
		log.info("closing " + remaining.size() + " chat sessions");
		for (var session: remaining) {
			session.close(Status.UNAVAILABLE.withDescription("chat is shutting down"));
		}
	}



	public int getSessionCount() {
		synchronized (lock) {
			return sessions.size();
		}
	}

	public Optional<ChatSession> getSession(String sessionId) {
		synchronized (lock) {
			return Optional.ofNullable(sessions.get(sessionId));
		}
	}

	public List<ChatSession> getSessions() {
		synchronized (lock) {
			return List.copyOf(sessions.values());
		}
	}



	static final Logger log = Logger.getLogger(ChatRoom.class.getName());
}
