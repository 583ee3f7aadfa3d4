package com.chanakya.vault.model.document;

import com.chanakya.vault.model.enums.GrantStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * A capability to read a fixed set of one patient's reports until {@code expiresAt}.
 * Only {@code active} ever changes, and only from true to false.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "access_grants")
@CompoundIndex(name = "ownerId_active_issuedAt", def = "{'ownerId': 1, 'active': 1, 'issuedAt': -1}")
public class AccessGrantDocument {

    @Id
    private String id;

    @Indexed(unique = true)
    private String token;

    private String ownerId;

    private List<String> reportIds;

    private Instant issuedAt;
    private Instant expiresAt;

    private boolean active;

    public boolean isUsableAt(Instant now) {
        return active && now.isBefore(expiresAt);
    }

    public GrantStatus statusAt(Instant now) {
        if (!active) {
            return GrantStatus.REVOKED;
        }
        return now.isBefore(expiresAt) ? GrantStatus.ACTIVE : GrantStatus.EXPIRED;
    }
}
