package com.distributedsystems.bhr.service;

import com.distributedsystems.bhr.exception.BhrException;
import com.distributedsystems.bhr.exception.BlockStillActiveException;
import com.distributedsystems.bhr.exception.InvalidBlockRequestException;
import com.distributedsystems.bhr.exception.NoSuchActiveBlockException;
import com.distributedsystems.bhr.exception.NoSuchBlockException;
import com.distributedsystems.bhr.model.BlockEntity;
import com.distributedsystems.bhr.proto.Acknowledge;
import com.distributedsystems.bhr.proto.AgentAction;
import com.distributedsystems.bhr.proto.BlockAgentServiceGrpc;
import com.distributedsystems.bhr.proto.QueueReply;
import com.distributedsystems.bhr.proto.QueueRequest;
import com.distributedsystems.bhr.proto.QueuedBlock;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.devh.boot.grpc.server.service.GrpcService;

import java.util.List;
import java.util.function.Supplier;

@Slf4j
@GrpcService
@RequiredArgsConstructor
public class AgentGrpcService extends BlockAgentServiceGrpc.BlockAgentServiceImplBase {

    private final BlockRegistry registry;
    private final BlockViews views;

    @Override
    public void getQueue(QueueRequest request, StreamObserver<QueueReply> out) {
        respond(out, () -> toReply(views.queue(request.getIdent(), limitOf(request))));
    }

    @Override
    public void getUnblockQueue(QueueRequest request, StreamObserver<QueueReply> out) {
        respond(out, () -> toReply(views.unblockQueue(request.getIdent(), limitOf(request))));
    }

    @Override
    public void setBlocked(AgentAction request, StreamObserver<Acknowledge> out) {
        respond(out, () -> {
            switch (request.getTargetCase()) {
                case CIDR -> registry.setBlocked(request.getCidr(), request.getIdent());
                case BLOCK_ID -> registry.setBlocked(request.getBlockId(), request.getIdent());
                default -> throw new InvalidBlockRequestException("cidr or block_id is required");
            }
            return ack("BLOCKED");
        });
    }

    @Override
    public void setUnblocked(AgentAction request, StreamObserver<Acknowledge> out) {
        respond(out, () -> {
            switch (request.getTargetCase()) {
                case CIDR -> registry.setUnblocked(request.getCidr(), request.getIdent());
                case BLOCK_ID -> registry.setUnblocked(request.getBlockId(), request.getIdent());
                default -> throw new InvalidBlockRequestException("cidr or block_id is required");
            }
            return ack("UNBLOCKED");
        });
    }

    @Override
    public void acknowledgeRemoval(AgentAction request, StreamObserver<Acknowledge> out) {
        respond(out, () -> {
            if (request.getTargetCase() != AgentAction.TargetCase.BLOCK_ID) {
                throw new InvalidBlockRequestException("block_id is required");
            }
            registry.acknowledgeRemoval(request.getBlockId(), request.getIdent());
            return ack("REMOVED");
        });
    }

    private <T> void respond(StreamObserver<T> out, Supplier<T> call) {
        T reply;
        try {
            reply = call.get();
        } catch (BhrException e) {
            log.warn("[grpc] {}: {}", e.getCode(), e.getMessage());
            out.onError(statusFor(e).withDescription(e.getCode() + ": " + e.getMessage()).asRuntimeException());
            return;
        } catch (Exception e) {
            log.error("[grpc] Agent call failed: {}", e.getMessage(), e);
            out.onError(Status.INTERNAL.withDescription(e.getMessage()).withCause(e).asRuntimeException());
            return;
        }
        out.onNext(reply);
        out.onCompleted();
    }

    static Status statusFor(BhrException e) {
        if (e instanceof NoSuchActiveBlockException || e instanceof NoSuchBlockException) {
            return Status.NOT_FOUND;
        }
        if (e instanceof BlockStillActiveException) {
            return Status.FAILED_PRECONDITION;
        }
        return Status.INVALID_ARGUMENT;
    }

    private static Integer limitOf(QueueRequest request) {
        return request.getLimit() > 0 ? request.getLimit() : null;
    }

    private static Acknowledge ack(String message) {
        return Acknowledge.newBuilder().setSuccess(true).setMessage(message).build();
    }

    private static QueueReply toReply(List<BlockEntity> blocks) {
        QueueReply.Builder reply = QueueReply.newBuilder();
        for (BlockEntity b : blocks) {
            reply.addBlocks(QueuedBlock.newBuilder()
                    .setBlockId(b.getId())
                    .setCidr(b.getCidr().toText())
                    .setSource(b.getSource())
                    .setWhy(b.getReason())
                    .setAddedEpochMs(b.getCreatedAt().toEpochMilli())
                    .setUnblockAtEpochMs(b.getExpiresAt() == null ? 0L : b.getExpiresAt().toEpochMilli()));
        }
        return reply.build();
    }
}
