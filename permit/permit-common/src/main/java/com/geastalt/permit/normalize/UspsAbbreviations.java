/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.normalize;

import java.util.Map;

/**
 * USPS Publication 28 street suffix, directional and secondary unit abbreviations.
 * Every abbreviation is a fixed point of the combined lookup, which keeps
 * {@link AddressNormalizer#normalizeAddress(String)} idempotent.
 */
final class UspsAbbreviations {

    private UspsAbbreviations() {}

    static final Map<String, String> DIRECTIONALS = Map.of(
            "NORTH", "N",
            "SOUTH", "S",
            "EAST", "E",
            "WEST", "W",
            "NORTHEAST", "NE",
            "NORTHWEST", "NW",
            "SOUTHEAST", "SE",
            "SOUTHWEST", "SW"
    );

    static final Map<String, String> UNIT_DESIGNATORS = Map.ofEntries(
            Map.entry("APARTMENT", "APT"), Map.entry("BASEMENT", "BSMT"), Map.entry("BUILDING", "BLDG"),
            Map.entry("DEPARTMENT", "DEPT"), Map.entry("FLOOR", "FL"), Map.entry("FRONT", "FRNT"),
            Map.entry("HANGAR", "HNGR"), Map.entry("LOBBY", "LBBY"), Map.entry("LOT", "LOT"),
            Map.entry("LOWER", "LOWR"), Map.entry("OFFICE", "OFC"), Map.entry("PENTHOUSE", "PH"),
            Map.entry("PIER", "PIER"), Map.entry("REAR", "REAR"), Map.entry("ROOM", "RM"),
            Map.entry("SIDE", "SIDE"), Map.entry("SLIP", "SLIP"), Map.entry("SPACE", "SPC"),
            Map.entry("STOP", "STOP"), Map.entry("SUITE", "STE"), Map.entry("TRAILER", "TRLR"),
            Map.entry("UNIT", "UNIT"), Map.entry("UPPER", "UPPR")
    );

    static final Map<String, String> STREET_SUFFIXES = Map.ofEntries(
            Map.entry("ALLEY", "ALY"), Map.entry("ALLEE", "ALY"), Map.entry("ALLY", "ALY"), Map.entry("ANNEX", "ANX"),
            Map.entry("ANEX", "ANX"), Map.entry("ANNX", "ANX"), Map.entry("ARCADE", "ARC"), Map.entry("AVENUE", "AVE"),
            Map.entry("AVENU", "AVE"), Map.entry("AVEN", "AVE"), Map.entry("AVNUE", "AVE"), Map.entry("AV", "AVE"),
            Map.entry("BAYOU", "BYU"), Map.entry("BAYOO", "BYU"), Map.entry("BEACH", "BCH"), Map.entry("BEND", "BND"),
            Map.entry("BLUFF", "BLF"), Map.entry("BLUF", "BLF"), Map.entry("BLUFFS", "BLFS"), Map.entry("BOTTOM", "BTM"),
            Map.entry("BOTTM", "BTM"), Map.entry("BOT", "BTM"), Map.entry("BOULEVARD", "BLVD"), Map.entry("BOUL", "BLVD"),
            Map.entry("BOULV", "BLVD"), Map.entry("BRANCH", "BR"), Map.entry("BRNCH", "BR"), Map.entry("BRIDGE", "BRG"),
            Map.entry("BRDGE", "BRG"), Map.entry("BROOK", "BRK"), Map.entry("BRROK", "BRK"), Map.entry("BROOKS", "BRKS"),
            Map.entry("BURG", "BG"), Map.entry("BURGS", "BGS"), Map.entry("BYPASS", "BYP"), Map.entry("BYPA", "BYP"),
            Map.entry("BYPAS", "BYP"), Map.entry("BYPS", "BYP"), Map.entry("CAMP", "CP"), Map.entry("CMP", "CP"),
            Map.entry("CANYON", "CYN"), Map.entry("CANYN", "CYN"), Map.entry("CNYN", "CYN"), Map.entry("CAPE", "CPE"),
            Map.entry("CAUSEWAY", "CSWY"), Map.entry("CAUSWA", "CSWY"), Map.entry("CENTER", "CTR"), Map.entry("CENT", "CTR"),
            Map.entry("CENTR", "CTR"), Map.entry("CENTRE", "CTR"), Map.entry("CNTER", "CTR"), Map.entry("CNTR", "CTR"),
            Map.entry("CENTERS", "CTRS"), Map.entry("CIRCLE", "CIR"), Map.entry("CIRC", "CIR"), Map.entry("CIRCL", "CIR"),
            Map.entry("CRCL", "CIR"), Map.entry("CRCLE", "CIR"), Map.entry("CIRCLES", "CIRS"), Map.entry("CLIFF", "CLF"),
            Map.entry("CLIFFS", "CLFS"), Map.entry("CLUB", "CLB"), Map.entry("COMMON", "CMN"), Map.entry("COMMONS", "CMNS"),
            Map.entry("CORNER", "COR"), Map.entry("CORNERS", "CORS"), Map.entry("COURSE", "CRSE"), Map.entry("COURT", "CT"),
            Map.entry("CRT", "CT"), Map.entry("COURTS", "CTS"), Map.entry("COVE", "CV"), Map.entry("COVES", "CVS"),
            Map.entry("CREEK", "CRK"), Map.entry("CK", "CRK"), Map.entry("CR", "CRK"), Map.entry("CRESCENT", "CRES"),
            Map.entry("CRSENT", "CRES"), Map.entry("CRSNT", "CRES"), Map.entry("CREST", "CRST"), Map.entry("CROSSING", "XING"),
            Map.entry("CRSSNG", "XING"), Map.entry("CROSSROAD", "XRD"), Map.entry("CROSSROADS", "XRDS"), Map.entry("CURVE", "CURV"),
            Map.entry("DALE", "DL"), Map.entry("DAM", "DM"), Map.entry("DIVIDE", "DV"), Map.entry("DIV", "DV"),
            Map.entry("DVD", "DV"), Map.entry("DRIVE", "DR"), Map.entry("DRIV", "DR"), Map.entry("DRV", "DR"),
            Map.entry("DRIVES", "DRS"), Map.entry("ESTATE", "EST"), Map.entry("ESTATES", "ESTS"), Map.entry("EXPRESSWAY", "EXPY"),
            Map.entry("EXP", "EXPY"), Map.entry("EXPR", "EXPY"), Map.entry("EXPRESS", "EXPY"), Map.entry("EXPW", "EXPY"),
            Map.entry("EXTENSION", "EXT"), Map.entry("EXTN", "EXT"), Map.entry("EXTNSN", "EXT"), Map.entry("EXTENSIONS", "EXTS"),
            Map.entry("FALL", "FALL"), Map.entry("FALLS", "FLS"), Map.entry("FERRY", "FRY"), Map.entry("FRRY", "FRY"),
            Map.entry("FIELD", "FLD"), Map.entry("FIELDS", "FLDS"), Map.entry("FLAT", "FLT"), Map.entry("FLATS", "FLTS"),
            Map.entry("FORD", "FRD"), Map.entry("FORDS", "FRDS"), Map.entry("FOREST", "FRST"), Map.entry("FORESTS", "FRST"),
            Map.entry("FORGE", "FRG"), Map.entry("FORG", "FRG"), Map.entry("FORGES", "FRGS"), Map.entry("FORK", "FRK"),
            Map.entry("FORKS", "FRKS"), Map.entry("FORT", "FT"), Map.entry("FRT", "FT"), Map.entry("FREEWAY", "FWY"),
            Map.entry("FREEWY", "FWY"), Map.entry("FRWAY", "FWY"), Map.entry("FRWY", "FWY"), Map.entry("GARDEN", "GDN"),
            Map.entry("GARDN", "GDN"), Map.entry("GRDEN", "GDN"), Map.entry("GRDN", "GDN"), Map.entry("GARDENS", "GDNS"),
            Map.entry("GRDNS", "GDNS"), Map.entry("GATEWAY", "GTWY"), Map.entry("GATEWY", "GTWY"), Map.entry("GATWAY", "GTWY"),
            Map.entry("GTWAY", "GTWY"), Map.entry("GLEN", "GLN"), Map.entry("GLENS", "GLNS"), Map.entry("GREEN", "GRN"),
            Map.entry("GREENS", "GRNS"), Map.entry("GROVE", "GRV"), Map.entry("GROV", "GRV"), Map.entry("GROVES", "GRVS"),
            Map.entry("HARBOR", "HBR"), Map.entry("HARB", "HBR"), Map.entry("HARBR", "HBR"), Map.entry("HRBOR", "HBR"),
            Map.entry("HARBORS", "HBRS"), Map.entry("HAVEN", "HVN"), Map.entry("HAVN", "HVN"), Map.entry("HEIGHTS", "HTS"),
            Map.entry("HEIGHT", "HTS"), Map.entry("HGTS", "HTS"), Map.entry("HT", "HTS"), Map.entry("HIGHWAY", "HWY"),
            Map.entry("HIGHWY", "HWY"), Map.entry("HIWAY", "HWY"), Map.entry("HIWY", "HWY"), Map.entry("HWAY", "HWY"),
            Map.entry("HILL", "HL"), Map.entry("HILLS", "HLS"), Map.entry("HOLLOW", "HOLW"), Map.entry("HLLW", "HOLW"),
            Map.entry("HOLLOWS", "HOLW"), Map.entry("HOLWS", "HOLW"), Map.entry("INLET", "INLT"), Map.entry("ISLAND", "IS"),
            Map.entry("ISLND", "IS"), Map.entry("ISLANDS", "ISS"), Map.entry("ISLNDS", "ISS"), Map.entry("ISLE", "ISLE"),
            Map.entry("ISLES", "ISLE"), Map.entry("JUNCTION", "JCT"), Map.entry("JCTION", "JCT"), Map.entry("JCTN", "JCT"),
            Map.entry("JUNCTN", "JCT"), Map.entry("JUNCTON", "JCT"), Map.entry("JUNCTIONS", "JCTS"), Map.entry("JCTNS", "JCTS"),
            Map.entry("KEY", "KY"), Map.entry("KEYS", "KYS"), Map.entry("KNOLL", "KNL"), Map.entry("KNOL", "KNL"),
            Map.entry("KNOLLS", "KNLS"), Map.entry("LAKE", "LK"), Map.entry("LAKES", "LKS"), Map.entry("LAND", "LAND"),
            Map.entry("LANDING", "LNDG"), Map.entry("LNDNG", "LNDG"), Map.entry("LANE", "LN"), Map.entry("LANES", "LN"),
            Map.entry("LIGHT", "LGT"), Map.entry("LIGHTS", "LGTS"), Map.entry("LOAF", "LF"), Map.entry("LOCK", "LCK"),
            Map.entry("LOCKS", "LCKS"), Map.entry("LODGE", "LDG"), Map.entry("LDGE", "LDG"), Map.entry("LODG", "LDG"),
            Map.entry("LOOP", "LOOP"), Map.entry("LOOPS", "LOOP"), Map.entry("MALL", "MALL"), Map.entry("MANOR", "MNR"),
            Map.entry("MANORS", "MNRS"), Map.entry("MEADOW", "MDW"), Map.entry("MEADOWS", "MDWS"), Map.entry("MEDOWS", "MDWS"),
            Map.entry("MEWS", "MEWS"), Map.entry("MILL", "ML"), Map.entry("MILLS", "MLS"), Map.entry("MISSION", "MSN"),
            Map.entry("MISSN", "MSN"), Map.entry("MSSN", "MSN"), Map.entry("MOTORWAY", "MTWY"), Map.entry("MOUNT", "MT"),
            Map.entry("MNT", "MT"), Map.entry("MOUNTAIN", "MTN"), Map.entry("MNTAIN", "MTN"), Map.entry("MNTN", "MTN"),
            Map.entry("MOUNTIN", "MTN"), Map.entry("MTIN", "MTN"), Map.entry("MOUNTAINS", "MTNS"), Map.entry("MNTNS", "MTNS"),
            Map.entry("NECK", "NCK"), Map.entry("ORCHARD", "ORCH"), Map.entry("ORCHRD", "ORCH"), Map.entry("OVAL", "OVAL"),
            Map.entry("OVL", "OVAL"), Map.entry("OVERPASS", "OPAS"), Map.entry("PARK", "PARK"), Map.entry("PRK", "PARK"),
            Map.entry("PARKS", "PARK"), Map.entry("PARKWAY", "PKWY"), Map.entry("PARKWY", "PKWY"), Map.entry("PKWAY", "PKWY"),
            Map.entry("PKY", "PKWY"), Map.entry("PARKWAYS", "PKWY"), Map.entry("PKWYS", "PKWY"), Map.entry("PASS", "PASS"),
            Map.entry("PASSAGE", "PSGE"), Map.entry("PATH", "PATH"), Map.entry("PATHS", "PATH"), Map.entry("PIKE", "PIKE"),
            Map.entry("PIKES", "PIKE"), Map.entry("PINE", "PNE"), Map.entry("PINES", "PNES"), Map.entry("PLACE", "PL"),
            Map.entry("PLAIN", "PLN"), Map.entry("PLAINS", "PLNS"), Map.entry("PLAZA", "PLZ"), Map.entry("PLZA", "PLZ"),
            Map.entry("POINT", "PT"), Map.entry("POINTS", "PTS"), Map.entry("PORT", "PRT"), Map.entry("PORTS", "PRTS"),
            Map.entry("PRAIRIE", "PR"), Map.entry("PRR", "PR"), Map.entry("RADIAL", "RADL"), Map.entry("RAD", "RADL"),
            Map.entry("RADIEL", "RADL"), Map.entry("RAMP", "RAMP"), Map.entry("RANCH", "RNCH"), Map.entry("RANCHES", "RNCH"),
            Map.entry("RNCHS", "RNCH"), Map.entry("RAPID", "RPD"), Map.entry("RAPIDS", "RPDS"), Map.entry("REST", "RST"),
            Map.entry("RIDGE", "RDG"), Map.entry("RDGE", "RDG"), Map.entry("RIDGES", "RDGS"), Map.entry("RIVER", "RIV"),
            Map.entry("RVR", "RIV"), Map.entry("RIVR", "RIV"), Map.entry("ROAD", "RD"), Map.entry("ROADS", "RDS"),
            Map.entry("ROUTE", "RTE"), Map.entry("ROW", "ROW"), Map.entry("RUE", "RUE"), Map.entry("RUN", "RUN"),
            Map.entry("SHOAL", "SHL"), Map.entry("SHOALS", "SHLS"), Map.entry("SHORE", "SHR"), Map.entry("SHOAR", "SHR"),
            Map.entry("SHORES", "SHRS"), Map.entry("SHOARS", "SHRS"), Map.entry("SKYWAY", "SKWY"), Map.entry("SPRING", "SPG"),
            Map.entry("SPNG", "SPG"), Map.entry("SPRNG", "SPG"), Map.entry("SPRINGS", "SPGS"), Map.entry("SPNGS", "SPGS"),
            Map.entry("SPRNGS", "SPGS"), Map.entry("SPUR", "SPUR"), Map.entry("SPURS", "SPUR"), Map.entry("SQUARE", "SQ"),
            Map.entry("SQR", "SQ"), Map.entry("SQRE", "SQ"), Map.entry("SQU", "SQ"), Map.entry("SQUARES", "SQS"),
            Map.entry("SQRS", "SQS"), Map.entry("STATION", "STA"), Map.entry("STATN", "STA"), Map.entry("STN", "STA"),
            Map.entry("STRAVENUE", "STRA"), Map.entry("STRAV", "STRA"), Map.entry("STRAVEN", "STRA"), Map.entry("STRAVN", "STRA"),
            Map.entry("STRVN", "STRA"), Map.entry("STRVNUE", "STRA"), Map.entry("STREAM", "STRM"), Map.entry("STREME", "STRM"),
            Map.entry("STREET", "ST"), Map.entry("STRT", "ST"), Map.entry("STR", "ST"), Map.entry("STREETS", "STS"),
            Map.entry("SUMMIT", "SMT"), Map.entry("SUMIT", "SMT"), Map.entry("SUMITT", "SMT"), Map.entry("TERRACE", "TER"),
            Map.entry("TERR", "TER"), Map.entry("THROUGHWAY", "TRWY"), Map.entry("TRACE", "TRCE"), Map.entry("TRACES", "TRCE"),
            Map.entry("TRACK", "TRAK"), Map.entry("TRACKS", "TRAK"), Map.entry("TRK", "TRAK"), Map.entry("TRKS", "TRAK"),
            Map.entry("TRAFFICWAY", "TRFY"), Map.entry("TRAIL", "TRL"), Map.entry("TRAILS", "TRL"), Map.entry("TRLS", "TRL"),
            Map.entry("TRAILER", "TRLR"), Map.entry("TRLRS", "TRLR"), Map.entry("TUNNEL", "TUNL"), Map.entry("TUNEL", "TUNL"),
            Map.entry("TUNLS", "TUNL"), Map.entry("TUNNELS", "TUNL"), Map.entry("TUNNL", "TUNL"), Map.entry("TURNPIKE", "TPKE"),
            Map.entry("TRNPK", "TPKE"), Map.entry("TURNPK", "TPKE"), Map.entry("UNDERPASS", "UPAS"), Map.entry("UNION", "UN"),
            Map.entry("UNIONS", "UNS"), Map.entry("VALLEY", "VLY"), Map.entry("VALLY", "VLY"), Map.entry("VLLY", "VLY"),
            Map.entry("VALLEYS", "VLYS"), Map.entry("VIADUCT", "VIA"), Map.entry("VDCT", "VIA"), Map.entry("VIADCT", "VIA"),
            Map.entry("VIEW", "VW"), Map.entry("VIEWS", "VWS"), Map.entry("VILLAGE", "VLG"), Map.entry("VILL", "VLG"),
            Map.entry("VILLAG", "VLG"), Map.entry("VILLG", "VLG"), Map.entry("VILLIAGE", "VLG"), Map.entry("VILLAGES", "VLGS"),
            Map.entry("VILLE", "VL"), Map.entry("VISTA", "VIS"), Map.entry("VIST", "VIS"), Map.entry("VST", "VIS"),
            Map.entry("VSTA", "VIS"), Map.entry("WALK", "WALK"), Map.entry("WALKS", "WALK"), Map.entry("WALL", "WALL"),
            Map.entry("WAY", "WAY"), Map.entry("WAYS", "WAYS"), Map.entry("WELL", "WL"), Map.entry("WELLS", "WLS")
    );

    /**
     * Directionals win over suffixes, suffixes over unit designators.
     */
    static String abbreviate(String word) {
        String abbreviation = DIRECTIONALS.get(word);
        if (abbreviation == null) {
            abbreviation = STREET_SUFFIXES.get(word);
        }
        if (abbreviation == null) {
            abbreviation = UNIT_DESIGNATORS.get(word);
        }
        return abbreviation != null ? abbreviation : word;
    }
}
