package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Statute metadata for one language version.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedAct {
    String actId;
    Language language;
    String title;
    String longTitle;
    String runningHead;
    SectionStatus status;
    String inForceDate;
    String consolidationDate;
    String lastAmendedDate;
    String enactedDate;
    String billOrigin;
    String billType;
    String hasPreviousVersion;
    String consolidatedNumber;
    String consolidatedNumberOfficial;
    String annualStatuteYear;
    String annualStatuteChapter;
    String shortTitleStatus;
    LimsMetadata limsMetadata;
    BillHistory billHistory;
    List<Amendment> recentAmendments;
    List<PreambleProvision> preamble;
    List<RelatedProvision> relatedProvisions;
    List<TreatyContent> treaties;
    List<SignatureBlock> signatureBlocks;
    List<TableOfProvisionsEntry> tableOfProvisions;
}
