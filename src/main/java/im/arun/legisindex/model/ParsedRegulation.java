package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Regulation metadata for one language version. {@code regulationId} is the normalized
 * instrument number ({@code SOR/97-175} becomes {@code SOR-97-175}).
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedRegulation {
    String regulationId;
    Language language;
    String instrumentNumber;
    String regulationType;
    String gazettePart;
    String title;
    String longTitle;
    List<EnablingAuthority> enablingAuthorities;
    String enablingActId;
    String enablingActTitle;
    SectionStatus status;
    String hasPreviousVersion;
    String registrationDate;
    String consolidationDate;
    String lastAmendedDate;
    LimsMetadata limsMetadata;
    RegulationMakerOrder regulationMakerOrder;
    EnablingAuthorityOrder enablingAuthorityOrder;
    List<Amendment> recentAmendments;
    List<RelatedProvision> relatedProvisions;
    List<TreatyContent> treaties;
    List<PublicationItem> recommendations;
    List<PublicationItem> notices;
    List<SignatureBlock> signatureBlocks;
    List<TableOfProvisionsEntry> tableOfProvisions;
}
