package com.distributedsystems.bhr.model;

import com.distributedsystems.bhr.util.Network;
import com.distributedsystems.bhr.util.NetworkConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "whitelist_entry")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WhitelistEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Convert(converter = NetworkConverter.class)
    @Column(nullable = false, unique = true, length = 64)
    private Network cidr;

    @Column(nullable = false, length = 128)
    private String who;

    @Column(nullable = false, length = 1024)
    private String why;

    @Column(nullable = false)
    private Instant createdAt;
}
