/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.normalize;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonical forms for scraped location and identity fields.
 * <p>
 * Two records describing the same permit should normalize to the same strings even when the
 * source portals format them differently, which is what makes the address hash usable as a
 * dedup key. None of these methods throw on malformed input: missing or unusable values
 * normalize to {@code null}.
 */
public final class AddressNormalizer {

    private static final Pattern COMPOUND_DIRECTIONAL = Pattern.compile("\\b([NSEW])\\.([NSEW]?)\\.?\\b");
    private static final Pattern ADDRESS_PUNCTUATION = Pattern.compile("[.,#]");
    private static final Pattern QUOTES = Pattern.compile("['\"]");
    private static final Pattern ORDINAL = Pattern.compile("\\b(\\d+)(ST|ND|RD|TH)\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern COUNTY_SUFFIX = Pattern.compile("\\s+COUNTY$");
    private static final Pattern SAINT = Pattern.compile("\\bST\\.?\\s");
    private static final Pattern COUNTY_PUNCTUATION = Pattern.compile("[.,]");

    private static final Pattern NAME_PUNCTUATION = Pattern.compile("[.,'\"()]");
    private static final Pattern GENERATIONAL_SUFFIX = Pattern.compile("\\b(JR|SR|II|III|IV|V|ESQ|PHD|MD|DDS)\\b");
    private static final Pattern BUSINESS_DESIGNATOR = Pattern.compile(
            "\\b(LLC|INC|INCORPORATED|CORP|CORPORATION|LTD|LIMITED|LP|LLP|PC|PLLC|"
                    + "CO|COMPANY|TRUST|ESTATE|PARTNERSHIP)\\b");

    static final Map<String, String> STATE_CODES = Map.ofEntries(
            Map.entry("ALABAMA", "AL"), Map.entry("ALASKA", "AK"), Map.entry("ARIZONA", "AZ"),
            Map.entry("ARKANSAS", "AR"), Map.entry("CALIFORNIA", "CA"), Map.entry("COLORADO", "CO"),
            Map.entry("CONNECTICUT", "CT"), Map.entry("DELAWARE", "DE"), Map.entry("FLORIDA", "FL"),
            Map.entry("GEORGIA", "GA"), Map.entry("HAWAII", "HI"), Map.entry("IDAHO", "ID"),
            Map.entry("ILLINOIS", "IL"), Map.entry("INDIANA", "IN"), Map.entry("IOWA", "IA"),
            Map.entry("KANSAS", "KS"), Map.entry("KENTUCKY", "KY"), Map.entry("LOUISIANA", "LA"),
            Map.entry("MAINE", "ME"), Map.entry("MARYLAND", "MD"), Map.entry("MASSACHUSETTS", "MA"),
            Map.entry("MICHIGAN", "MI"), Map.entry("MINNESOTA", "MN"), Map.entry("MISSISSIPPI", "MS"),
            Map.entry("MISSOURI", "MO"), Map.entry("MONTANA", "MT"), Map.entry("NEBRASKA", "NE"),
            Map.entry("NEVADA", "NV"), Map.entry("NEW HAMPSHIRE", "NH"), Map.entry("NEW JERSEY", "NJ"),
            Map.entry("NEW MEXICO", "NM"), Map.entry("NEW YORK", "NY"), Map.entry("NORTH CAROLINA", "NC"),
            Map.entry("NORTH DAKOTA", "ND"), Map.entry("OHIO", "OH"), Map.entry("OKLAHOMA", "OK"),
            Map.entry("OREGON", "OR"), Map.entry("PENNSYLVANIA", "PA"), Map.entry("RHODE ISLAND", "RI"),
            Map.entry("SOUTH CAROLINA", "SC"), Map.entry("SOUTH DAKOTA", "SD"), Map.entry("TENNESSEE", "TN"),
            Map.entry("TEXAS", "TX"), Map.entry("UTAH", "UT"), Map.entry("VERMONT", "VT"),
            Map.entry("VIRGINIA", "VA"), Map.entry("WASHINGTON", "WA"), Map.entry("WEST VIRGINIA", "WV"),
            Map.entry("WISCONSIN", "WI"), Map.entry("WYOMING", "WY"),
            Map.entry("DISTRICT OF COLUMBIA", "DC"), Map.entry("PUERTO RICO", "PR"), Map.entry("GUAM", "GU"),
            Map.entry("VIRGIN ISLANDS", "VI"), Map.entry("AMERICAN SAMOA", "AS"),
            Map.entry("NORTHERN MARIANA ISLANDS", "MP")
    );

    static final Set<String> VALID_STATE_CODES = Set.copyOf(STATE_CODES.values());

    private AddressNormalizer() {}

    /**
     * Normalizes a street address to USPS abbreviations.
     * <pre>
     *   "123 North Main Street, Apt. 4B" -> "123 N MAIN ST APT 4B"
     *   "456 S.W. Oak Avenue #201"       -> "456 SW OAK AVE 201"
     * </pre>
     */
    public static String normalizeAddress(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }

        String normalized = address.toUpperCase(Locale.ROOT);

        // S.W. -> SW has to happen before the periods are stripped
        normalized = COMPOUND_DIRECTIONAL.matcher(normalized).replaceAll("$1$2");
        normalized = ADDRESS_PUNCTUATION.matcher(normalized).replaceAll(" ");
        normalized = QUOTES.matcher(normalized).replaceAll("");

        String abbreviated = WHITESPACE.splitAsStream(normalized.trim())
                .filter(word -> !word.isEmpty())
                .map(UspsAbbreviations::abbreviate)
                .collect(Collectors.joining(" "));

        String result = collapseWhitespace(ORDINAL.matcher(abbreviated).replaceAll("$1"));
        return result.isEmpty() ? null : result;
    }

    /**
     * Normalizes a county name: {@code "St. Louis County"} becomes {@code "SAINT LOUIS"}.
     */
    public static String normalizeCounty(String county) {
        if (county == null || county.isBlank()) {
            return null;
        }

        String normalized = county.toUpperCase(Locale.ROOT).trim();
        normalized = COUNTY_SUFFIX.matcher(normalized).replaceAll("");
        normalized = SAINT.matcher(normalized).replaceAll("SAINT ");
        normalized = COUNTY_PUNCTUATION.matcher(normalized).replaceAll("");

        String result = collapseWhitespace(normalized);
        return result.isEmpty() ? null : result;
    }

    /**
     * Resolves a two-letter code or a full state/territory name to its two-letter code.
     *
     * @return the code, or {@code null} when the input is neither a known code nor a known name
     */
    public static String normalizeState(String state) {
        if (state == null || state.isBlank()) {
            return null;
        }

        String normalized = state.toUpperCase(Locale.ROOT).trim();
        if (normalized.length() == 2) {
            return VALID_STATE_CODES.contains(normalized) ? normalized : null;
        }
        return STATE_CODES.get(normalized);
    }

    /**
     * Normalizes an owner or applicant name for matching, dropping generational suffixes
     * and business-entity designators.
     */
    public static String normalizeOwnerName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }

        String normalized = name.toUpperCase(Locale.ROOT).trim();
        normalized = NAME_PUNCTUATION.matcher(normalized).replaceAll("");
        normalized = GENERATIONAL_SUFFIX.matcher(normalized).replaceAll("");
        normalized = BUSINESS_DESIGNATOR.matcher(normalized).replaceAll("");

        String result = collapseWhitespace(normalized);
        return result.isEmpty() ? null : result;
    }

    /**
     * SHA-256 of {@code address|COUNTY|STATE}, hex encoded. Missing county or state contribute an
     * empty component.
     *
     * @return the 64-character digest, or {@code null} when there is no normalized address
     */
    public static String computeAddressHash(String normalizedAddress, String normalizedCounty, String stateCode) {
        if (normalizedAddress == null || normalizedAddress.isEmpty()) {
            return null;
        }

        String compositeKey = normalizedAddress
                + "|" + (normalizedCounty != null ? normalizedCounty.toUpperCase(Locale.ROOT) : "")
                + "|" + (stateCode != null ? stateCode.toUpperCase(Locale.ROOT) : "");
        return sha256Hex(compositeKey);
    }

    /**
     * Normalizes all three location components and computes their hash in one step.
     */
    public static NormalizedLocation normalizeAndHash(String address, String county, String state) {
        String normalizedAddress = normalizeAddress(address);
        String normalizedCounty = normalizeCounty(county);
        String stateCode = normalizeState(state);
        return new NormalizedLocation(normalizedAddress, normalizedCounty, stateCode,
                computeAddressHash(normalizedAddress, normalizedCounty, stateCode));
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String collapseWhitespace(String value) {
        return WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }

    public record NormalizedLocation(String address, String county, String stateCode, String addressHash) {}
}
