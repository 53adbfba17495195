package im.arun.legisindex.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class LegisIndexConfig {
    private List<String> crossReferenceTypes = new ArrayList<>(List.of("act", "regulation"));
    private boolean emphasisPairing = true;
    private int emphasisMaxWords = 6;
    private int emphasisMaxLength = 60;
    private boolean headingRecords = true;
    private int threads = 0;
    private int perFileTimeoutSeconds = 120;
    private String logDirectory = "./logs";
    private boolean writeRunLog = true;
}
