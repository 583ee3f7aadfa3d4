package com.chanakya.vault.model.document;

import com.chanakya.vault.model.enums.AccessType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "access_logs")
@CompoundIndex(name = "ownerId_accessedAt", def = "{'ownerId': 1, 'accessedAt': -1}")
public class AccessLogDocument {

    @Id
    private String id;

    private String ownerId;
    private String grantId;
    private String reportId;
    private AccessType accessType;
    private String detail;
    private Instant accessedAt;
}
