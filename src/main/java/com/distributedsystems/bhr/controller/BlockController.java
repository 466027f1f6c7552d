package com.distributedsystems.bhr.controller;

import com.distributedsystems.bhr.client.AgentActionDTO;
import com.distributedsystems.bhr.client.BlockRequestDTO;
import com.distributedsystems.bhr.client.WithdrawRequestDTO;
import com.distributedsystems.bhr.exception.InvalidBlockRequestException;
import com.distributedsystems.bhr.exception.NoSuchBlockException;
import com.distributedsystems.bhr.exe.BhrConfig;
import com.distributedsystems.bhr.model.BlockEntity;
import com.distributedsystems.bhr.service.BlockRegistry;
import com.distributedsystems.bhr.service.BlockViews;
import com.distributedsystems.bhr.util.BlockCsvCodec;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.StringReader;
import java.net.URI;
import java.security.Principal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class BlockController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final BlockRegistry registry;
    private final BlockViews views;
    private final BlockCsvCodec csvCodec;
    private final BhrConfig config;

    /**
     * Repeating the request for a network that is already blocked answers with the same
     * block (same id and url).
     */
    @PostMapping("/block")
    public ResponseEntity<BlockResponse> addBlock(@RequestBody BlockRequestDTO dto, Principal principal) {
        Duration duration = dto.getDuration() == null ? null : Duration.ofSeconds(dto.getDuration());
        BlockEntity block = registry.addBlock(dto.getCidr(), requester(principal), dto.getSource(), dto.getWhy(),
                duration, dto.isSkipWhitelist());
        BlockResponse body = BlockResponse.from(block);
        return ResponseEntity.created(URI.create(body.url())).body(body);
    }

    @GetMapping("/block/{id}")
    public BlockResponse getBlock(@PathVariable long id) {
        return BlockResponse.from(registry.getBlockById(id));
    }

    @GetMapping("/block")
    public BlockResponse findBlock(@RequestParam String cidr) {
        return registry.getBlock(cidr)
                .map(BlockResponse::from)
                .orElseThrow(() -> new NoSuchBlockException(cidr));
    }

    @PostMapping("/block/{id}/set_blocked")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void setBlocked(@PathVariable long id, @RequestBody AgentActionDTO dto) {
        registry.setBlocked(id, dto.getIdent());
    }

    @PostMapping("/block/{id}/set_unblocked")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void setUnblocked(@PathVariable long id, @RequestBody AgentActionDTO dto) {
        registry.setUnblocked(id, dto.getIdent());
    }

    @PostMapping("/mark_blocked")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void markBlocked(@RequestBody AgentActionDTO dto) {
        registry.setBlocked(requireCidr(dto), dto.getIdent());
    }

    @PostMapping("/mark_unblocked")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void markUnblocked(@RequestBody AgentActionDTO dto) {
        registry.setUnblocked(requireCidr(dto), dto.getIdent());
    }

    @PostMapping("/block/{id}/withdraw")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void withdraw(@PathVariable long id,
                         @RequestBody(required = false) WithdrawRequestDTO dto,
                         Principal principal) {
        registry.withdraw(id, requester(principal), dto == null ? null : dto.getWhy());
    }

    @PostMapping("/block/{id}/removed")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void acknowledgeRemoval(@PathVariable long id, @RequestBody AgentActionDTO dto) {
        registry.acknowledgeRemoval(id, dto.getIdent());
    }

    @GetMapping("/queue/{ident}")
    public List<BlockResponse> queue(@PathVariable String ident,
                                     @RequestParam(required = false) Integer limit) {
        return toResponses(views.queue(ident, limit));
    }

    @GetMapping("/unblock_queue/{ident}")
    public List<BlockResponse> unblockQueue(@PathVariable String ident,
                                            @RequestParam(required = false) Integer limit) {
        return toResponses(views.unblockQueue(ident, limit));
    }

    @GetMapping("/expected")
    public List<BlockResponse> expected() {
        return toResponses(views.expected());
    }

    @GetMapping("/current")
    public List<BlockResponse> current() {
        return toResponses(views.current());
    }

    @GetMapping("/pending")
    public List<BlockResponse> pending() {
        return toResponses(views.pending());
    }

    @GetMapping(value = "/expected.csv", produces = "text/csv")
    public ResponseEntity<String> expectedCsv() {
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .body(csvCodec.write(views.expected()));
    }

    @PostMapping(value = "/blocks/bulk", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public List<BlockRegistry.BulkResult> bulkAdd(@RequestBody String csv, Principal principal) {
        List<BlockRegistry.BulkRequest> rows = csvCodec.read(new StringReader(csv));
        return registry.addBlocks(rows, requester(principal));
    }

    @GetMapping("/history")
    public List<BlockResponse> history(@RequestParam String cidr) {
        return toResponses(registry.history(cidr));
    }

    @GetMapping("/stats")
    public BlockViews.BlockStats stats() {
        return views.stats();
    }

    private String requester(Principal principal) {
        if (principal != null && principal.getName() != null && !principal.getName().isBlank()) {
            return principal.getName();
        }
        return config.getApi().getDefaultRequester();
    }

    private static String requireCidr(AgentActionDTO dto) {
        if (dto.getCidr() == null || dto.getCidr().isBlank()) {
            throw new InvalidBlockRequestException("cidr is required");
        }
        return dto.getCidr();
    }

    private static List<BlockResponse> toResponses(List<BlockEntity> blocks) {
        return blocks.stream().map(BlockResponse::from).toList();
    }

    public record BlockResponse(
            long id,
            String url,
            String cidr,
            String who,
            String source,
            String why,
            Instant added,
            @JsonProperty("unblock_at") Instant unblockAt,
            boolean active,
            @JsonProperty("set_blocked") String setBlocked,
            @JsonProperty("set_unblocked") String setUnblocked) {

        static BlockResponse from(BlockEntity b) {
            String url = "/api/block/" + b.getId();
            return new BlockResponse(
                    b.getId(),
                    url,
                    b.getCidr().toText(),
                    b.getRequestedBy(),
                    b.getSource(),
                    b.getReason(),
                    b.getCreatedAt(),
                    b.getExpiresAt(),
                    b.isActive(),
                    url + "/set_blocked",
                    url + "/set_unblocked");
        }
    }
}
