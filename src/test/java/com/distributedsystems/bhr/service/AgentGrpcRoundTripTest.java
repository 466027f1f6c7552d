package com.distributedsystems.bhr.service;

import com.distributedsystems.bhr.RegistryTestSupport;
import com.distributedsystems.bhr.model.BlockEntity;
import com.distributedsystems.bhr.proto.Acknowledge;
import com.distributedsystems.bhr.proto.AgentAction;
import com.distributedsystems.bhr.proto.BlockAgentServiceGrpc;
import com.distributedsystems.bhr.proto.QueueReply;
import com.distributedsystems.bhr.proto.QueueRequest;
import io.grpc.ManagedChannel;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Talks to the agent service through the in-process server named in the test
 * {@code grpc.server.in-process-name}.
 */
class AgentGrpcRoundTripTest extends RegistryTestSupport {

    @Autowired BlockRegistry registry;
    @Autowired BlockViews views;

    private ManagedChannel channel;
    private BlockAgentServiceGrpc.BlockAgentServiceBlockingStub stub;

    @BeforeEach
    void openChannel() {
        channel = InProcessChannelBuilder.forName("bhr-test").directExecutor().build();
        stub = BlockAgentServiceGrpc.newBlockingStub(channel);
    }

    @AfterEach
    void closeChannel() throws InterruptedException {
        channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void agentPollsConfirmsAndDrainsItsQueue() {
        BlockEntity block = registry.addBlock("1.2.3.4", "admin", "ids", "scan");

        QueueReply queue = stub.getQueue(QueueRequest.newBuilder().setIdent("bgp1").build());
        assertEquals(1, queue.getBlocksCount());
        assertEquals(block.getId(), queue.getBlocks(0).getBlockId());
        assertEquals("1.2.3.4/32", queue.getBlocks(0).getCidr());

        Acknowledge ack = stub.setBlocked(AgentAction.newBuilder()
                .setIdent("bgp1")
                .setBlockId(queue.getBlocks(0).getBlockId())
                .build());
        assertTrue(ack.getSuccess());

        assertEquals(0, stub.getQueue(QueueRequest.newBuilder().setIdent("bgp1").build()).getBlocksCount());
        assertEquals(1, views.current().size());
    }

    @Test
    void withdrawnBlockReachesTheUnblockQueueOverTheWire() {
        BlockEntity block = registry.addBlock("1.2.3.4", "admin", "ids", "scan");
        stub.setBlocked(AgentAction.newBuilder().setIdent("bgp1").setCidr("1.2.3.4").build());
        registry.withdraw(block.getId());

        QueueReply unblock = stub.getUnblockQueue(QueueRequest.newBuilder().setIdent("bgp1").build());
        assertEquals(1, unblock.getBlocksCount());

        Acknowledge ack = stub.acknowledgeRemoval(AgentAction.newBuilder()
                .setIdent("bgp1")
                .setBlockId(block.getId())
                .build());
        assertEquals("REMOVED", ack.getMessage());
        assertEquals(0, stub.getUnblockQueue(QueueRequest.newBuilder().setIdent("bgp1").build()).getBlocksCount());
    }

    @Test
    void unknownNetworkComesBackAsNotFound() {
        StatusRuntimeException e = assertThrows(StatusRuntimeException.class,
                () -> stub.setBlocked(AgentAction.newBuilder().setIdent("bgp1").setCidr("5.6.7.8").build()));
        assertEquals(Status.Code.NOT_FOUND, e.getStatus().getCode());
        assertTrue(e.getStatus().getDescription().startsWith("no_such_active_block"));
    }
}
