package im.arun.legisindex.util;

import im.arun.legisindex.model.Language;

/**
 * Regulation identifier helpers.
 *
 * <p>The same regulation is published under different ids per language:
 * {@code SOR-97-175} / {@code DORS-97-175}, {@code SI-2000-1} / {@code TR-2000-1},
 * {@code C.R.C._c. 870} / {@code C.R.C._ch. 870}, and annual statutes
 * {@code 2018_c. 12_s. 187} / {@code 2018_ch. 12_art. 187}.
 */
public final class RegulationIds {

    private RegulationIds() {}

    /**
     * {@code SOR/97-175} becomes {@code SOR-97-175}; {@code "c. 12, s. 187"} becomes
     * {@code "c. 12_s. 187"}.
     */
    public static String normalize(String instrumentNumber) {
        return instrumentNumber.replace("/", "-").replaceAll(",\\s*", "_");
    }

    /**
     * Maps a regulation id to its counterpart in the other language. Unknown formats are
     * returned unchanged.
     */
    public static String translate(String regulationId, Language from, Language to) {
        if (from == to) {
            return regulationId;
        }
        if (to == Language.FR) {
            if (regulationId.startsWith("C.R.C._c. ")) {
                return "C.R.C._ch. " + regulationId.substring("C.R.C._c. ".length());
            }
            if (regulationId.startsWith("SOR-")) {
                return "DORS-" + regulationId.substring(4);
            }
            if (regulationId.startsWith("SI-")) {
                return "TR-" + regulationId.substring(3);
            }
            if (regulationId.contains("_c. ") && regulationId.contains("_s. ")) {
                return regulationId.replaceFirst("_c\\. ", "_ch. ").replaceFirst("_s\\. ", "_art. ");
            }
        } else {
            if (regulationId.startsWith("C.R.C._ch. ")) {
                return "C.R.C._c. " + regulationId.substring("C.R.C._ch. ".length());
            }
            if (regulationId.startsWith("DORS-")) {
                return "SOR-" + regulationId.substring(5);
            }
            if (regulationId.startsWith("TR-")) {
                return "SI-" + regulationId.substring(3);
            }
            if (regulationId.contains("_ch. ") && regulationId.contains("_art. ")) {
                return regulationId.replaceFirst("_ch\\. ", "_c. ").replaceFirst("_art\\. ", "_s. ");
            }
        }
        return regulationId;
    }
}
