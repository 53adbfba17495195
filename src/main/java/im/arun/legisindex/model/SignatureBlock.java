package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SignatureBlock {
    List<Line> lines;
    String witnessClause;
    String doneAt;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Line {
        String signatureName;
        String signatureTitle;
        String signatureDate;
        String signatureLocation;
    }
}
