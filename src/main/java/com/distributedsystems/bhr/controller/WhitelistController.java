package com.distributedsystems.bhr.controller;

import com.distributedsystems.bhr.client.WhitelistRequestDTO;
import com.distributedsystems.bhr.exe.BhrConfig;
import com.distributedsystems.bhr.model.WhitelistEntryEntity;
import com.distributedsystems.bhr.service.WhitelistService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/whitelist")
@RequiredArgsConstructor
public class WhitelistController {

    private final WhitelistService whitelistService;
    private final BhrConfig config;

    @GetMapping
    public List<WhitelistResponse> list() {
        return whitelistService.list().stream().map(WhitelistResponse::from).toList();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public WhitelistResponse add(@RequestBody WhitelistRequestDTO dto, Principal principal) {
        String who = principal != null ? principal.getName() : config.getApi().getDefaultRequester();
        return WhitelistResponse.from(whitelistService.add(dto.getCidr(), who, dto.getWhy()));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void remove(@PathVariable long id) {
        whitelistService.remove(id);
    }

    public record WhitelistResponse(long id, String cidr, String who, String why, Instant added) {
        static WhitelistResponse from(WhitelistEntryEntity e) {
            return new WhitelistResponse(e.getId(), e.getCidr().toText(), e.getWho(), e.getWhy(), e.getCreatedAt());
        }
    }
}
