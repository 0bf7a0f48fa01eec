package com.syntharb.api.dto.request;

import com.syntharb.domain.enums.FeedFormat;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.Data;

/**
 * A batch of raw feed records. JSON and CSV records are sent as text; BINARY records are
 * Base64-encoded.
 */
@Data
public class TickBatchRequest {

    @NotNull
    private FeedFormat format;

    @NotEmpty
    private List<String> records;

    /** Optional processing timeout in milliseconds. Runs synchronously when absent. */
    private Long timeoutMs;
}
