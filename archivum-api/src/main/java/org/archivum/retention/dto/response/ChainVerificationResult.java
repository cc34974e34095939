package org.archivum.retention.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.archivum.retention.enums.ImmutableCategory;

import java.util.List;

/**
 * Result of replaying an immutable chain. Malformed or tampered entries are listed, never thrown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChainVerificationResult(ImmutableCategory category,
                                      boolean valid,
                                      long totalEntries,
                                      long validEntries,
                                      long invalidEntries,
                                      double integrityScore,
                                      List<ChainError> errors) {

    public static final String HASH_MISMATCH = "hash mismatch";
    public static final String PARSE_ERROR = "parse error";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ChainError(long line,
                             Long entryIndex,
                             String reason,
                             String expected,
                             String actual,
                             String message) {}
}
