package im.arun.legisindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RegulationMakerOrder {
    String regulationMaker;
    String orderNumber;
    String orderDate;
}
