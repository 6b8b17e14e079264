// Copyright (c) Piotr Morgwai Kotarbinski, Licensed under the Apache License, Version 2.0
package pl.morgwai.samples.grpc.banking.chat;

import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import pl.morgwai.samples.grpc.banking.ChatMessage;
import pl.morgwai.samples.grpc.banking.ChatServiceGrpc.ChatServiceImplBase;



/**
 * Implements {@code ChatService}: each {@code chat} call becomes a {@link ChatSession} of
 * {@link #room}.
 */
public class ChatService extends ChatServiceImplBase {



	final ChatRoom room;

	public ChatService(ChatRoom room) {
		this.room = room;
	}



	@Override
	public StreamObserver<ChatMessage> chat(StreamObserver<ChatMessage> responseObserver) {
		return room.admit((ServerCallStreamObserver<ChatMessage>) responseObserver);
	}
}
