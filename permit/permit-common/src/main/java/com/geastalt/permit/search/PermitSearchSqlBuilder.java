/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.search;

import com.geastalt.permit.dto.PermitSearchRequest;
import com.geastalt.permit.normalize.AddressNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds the permit search statements.
 * <p>
 * Free-text queries match either the full-text vector or the trigram similarity of the normalized
 * address; relevance is {@code keywordWeight * ts_rank + similarityWeight * similarity}. The geo
 * filter is a bounding box of {@code miles / 69} degrees of latitude and
 * {@code miles / (69 * cos(latitude))} degrees of longitude, not a great-circle radius. Every
 * ordering ends with {@code p.id} so pages never overlap.
 */
@Slf4j
public class PermitSearchSqlBuilder {

    static final double MILES_PER_DEGREE = 69.0;

    private static final String FROM = " FROM septic_permits p"
            + " JOIN states s ON s.id = p.state_id"
            + " LEFT JOIN counties c ON c.id = p.county_id"
            + " LEFT JOIN septic_system_types st ON st.id = p.system_type_id";

    private static final String KEYWORD_RANK =
            "COALESCE(ts_rank(p.search_vector, plainto_tsquery('english', :query)), 0)";
    private static final String ADDRESS_SIMILARITY =
            "COALESCE(similarity(p.address_normalized, :queryNormalized), 0)";

    private final double similarityThreshold;
    private final double keywordWeight;
    private final double similarityWeight;

    public PermitSearchSqlBuilder(double similarityThreshold, double keywordWeight, double similarityWeight) {
        this.similarityThreshold = similarityThreshold;
        this.keywordWeight = keywordWeight;
        this.similarityWeight = similarityWeight;
    }

    /**
     * @param page     1-based page number
     * @param pageSize rows per page
     */
    public PermitSearchSql build(PermitSearchRequest request, int page, int pageSize,
                                 int stateFacetLimit, int countyFacetLimit) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> conditions = new ArrayList<>();

        if (!request.isIncludeInactive()) {
            conditions.add("p.is_active = true");
        }
        if (notEmpty(request.getStateCodes())) {
            conditions.add("s.code IN (:stateCodes)");
            params.addValue("stateCodes", stateCodes(request.getStateCodes()));
        }
        if (notEmpty(request.getCountyIds())) {
            conditions.add("p.county_id IN (:countyIds)");
            params.addValue("countyIds", request.getCountyIds());
        }
        if (hasText(request.getCity())) {
            conditions.add("p.city ILIKE :cityPattern");
            params.addValue("cityPattern", "%" + escapeLike(request.getCity().trim()) + "%");
        }
        if (hasText(request.getZipCode())) {
            conditions.add("p.zip_code = :zipCode");
            params.addValue("zipCode", request.getZipCode().trim());
        }
        if (notEmpty(request.getSystemTypeIds())) {
            conditions.add("p.system_type_id IN (:systemTypeIds)");
            params.addValue("systemTypeIds", request.getSystemTypeIds());
        }
        if (request.getPermitDateFrom() != null) {
            conditions.add("p.permit_date >= :permitDateFrom");
            params.addValue("permitDateFrom", request.getPermitDateFrom());
        }
        if (request.getPermitDateTo() != null) {
            conditions.add("p.permit_date <= :permitDateTo");
            params.addValue("permitDateTo", request.getPermitDateTo());
        }
        if (request.getInstallDateFrom() != null) {
            conditions.add("p.install_date >= :installDateFrom");
            params.addValue("installDateFrom", request.getInstallDateFrom());
        }
        if (request.getInstallDateTo() != null) {
            conditions.add("p.install_date <= :installDateTo");
            params.addValue("installDateTo", request.getInstallDateTo());
        }
        if (request.getLatitude() != null && request.getLongitude() != null && request.getRadiusMiles() != null) {
            BoundingBox box = BoundingBox.around(request.getLatitude(), request.getLongitude(), request.getRadiusMiles());
            conditions.add("p.latitude IS NOT NULL AND p.longitude IS NOT NULL");
            conditions.add("p.latitude BETWEEN :minLatitude AND :maxLatitude");
            params.addValue("minLatitude", box.minLatitude())
                    .addValue("maxLatitude", box.maxLatitude());
            if (box.coversAllLongitudes()) {
                log.debug("Radius search at latitude {} spans every longitude", request.getLatitude());
            } else if (box.crossesAntimeridian()) {
                conditions.add("(p.longitude BETWEEN :minLongitude AND :maxLongitude"
                        + " OR p.longitude BETWEEN :wrapMinLongitude AND :wrapMaxLongitude)");
                if (box.maxLongitude() > 180.0) {
                    params.addValue("minLongitude", box.minLongitude())
                            .addValue("maxLongitude", 180.0)
                            .addValue("wrapMinLongitude", -180.0)
                            .addValue("wrapMaxLongitude", box.maxLongitude() - 360.0);
                } else {
                    params.addValue("minLongitude", -180.0)
                            .addValue("maxLongitude", box.maxLongitude())
                            .addValue("wrapMinLongitude", box.minLongitude() + 360.0)
                            .addValue("wrapMaxLongitude", 180.0);
                }
            } else {
                conditions.add("p.longitude BETWEEN :minLongitude AND :maxLongitude");
                params.addValue("minLongitude", box.minLongitude())
                        .addValue("maxLongitude", box.maxLongitude());
            }
        }

        boolean hasQuery = hasText(request.getQuery());
        String scoreColumns;
        if (hasQuery) {
            String query = request.getQuery().trim();
            String normalized = AddressNormalizer.normalizeAddress(query);
            params.addValue("query", query)
                    .addValue("queryNormalized", normalized != null ? normalized : query.toUpperCase(Locale.ROOT))
                    .addValue("similarityThreshold", similarityThreshold);
            conditions.add("(p.search_vector @@ plainto_tsquery('english', :query) OR "
                    + ADDRESS_SIMILARITY + " > :similarityThreshold)");
            scoreColumns = KEYWORD_RANK + " AS keyword_score, "
                    + "(" + keywordWeight + " * " + KEYWORD_RANK + " + "
                    + similarityWeight + " * " + ADDRESS_SIMILARITY + ") AS combined_score";
        } else {
            scoreColumns = "CAST(NULL AS double precision) AS keyword_score, "
                    + "CAST(1.0 AS double precision) AS combined_score";
        }

        String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);

        params.addValue("limit", pageSize)
                .addValue("offset", (long) (page - 1) * pageSize)
                .addValue("stateFacetLimit", stateFacetLimit)
                .addValue("countyFacetLimit", countyFacetLimit);

        String selectSql = "SELECT p.id, p.permit_number, p.address, p.city, p.zip_code, p.owner_name,"
                + " p.permit_date, p.install_date, p.parcel_number, p.latitude, p.longitude, p.is_active,"
                + " p.system_type_raw, s.code AS state_code, c.name AS county_name,"
                + " st.name AS system_type_name, " + scoreColumns
                + FROM + where
                + " ORDER BY " + orderBy(request.getSortBy(), request.getSortOrder(), hasQuery)
                + " LIMIT :limit OFFSET :offset";
        String countSql = "SELECT COUNT(*)" + FROM + where;
        String stateFacetSql = "SELECT s.code AS bucket_key, s.name AS bucket_label, COUNT(*) AS bucket_count"
                + FROM + where
                + " GROUP BY s.code, s.name ORDER BY bucket_count DESC, s.code LIMIT :stateFacetLimit";
        String countyFacetSql = "SELECT CAST(c.id AS text) AS bucket_key, c.name AS bucket_label,"
                + " COUNT(*) AS bucket_count"
                + FROM + where + (where.isEmpty() ? " WHERE " : " AND ") + "p.county_id IS NOT NULL"
                + " GROUP BY c.id, c.name ORDER BY bucket_count DESC, c.name LIMIT :countyFacetLimit";

        log.debug("Permit search SQL: {}", selectSql);
        return new PermitSearchSql(selectSql, countSql, stateFacetSql, countyFacetSql, hasQuery, params);
    }

    static String orderBy(String sortBy, String sortOrder, boolean hasQuery) {
        String direction = "asc".equalsIgnoreCase(sortOrder) ? "ASC" : "DESC";
        String key = sortBy != null ? sortBy.trim().toLowerCase(Locale.ROOT) : "relevance";
        String primary = switch (key) {
            case "relevance" -> hasQuery ? "combined_score " + direction : "p.created_at DESC";
            case "permit_date" -> "p.permit_date " + direction + " NULLS LAST";
            case "address" -> "p.address_normalized " + direction + " NULLS LAST";
            case "owner_name" -> "p.owner_name " + direction + " NULLS LAST";
            default -> "p.created_at DESC";
        };
        return primary + ", p.id ASC";
    }

    private static List<String> stateCodes(List<String> values) {
        return values.stream()
                .filter(Objects::nonNull)
                .map(value -> {
                    String code = AddressNormalizer.normalizeState(value);
                    return code != null ? code : value.trim().toUpperCase(Locale.ROOT);
                })
                .distinct()
                .toList();
    }

    public static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean notEmpty(List<?> values) {
        return values != null && !values.isEmpty();
    }

    record BoundingBox(double minLatitude, double maxLatitude, double minLongitude, double maxLongitude) {

        static BoundingBox around(double latitude, double longitude, double radiusMiles) {
            double latDelta = radiusMiles / MILES_PER_DEGREE;
            double cosLat = Math.cos(Math.toRadians(latitude));
            double lonDelta = cosLat > 1e-6 ? Math.min(180.0, radiusMiles / (MILES_PER_DEGREE * cosLat)) : 180.0;
            return new BoundingBox(latitude - latDelta, latitude + latDelta, longitude - lonDelta, longitude + lonDelta);
        }

        boolean coversAllLongitudes() {
            return maxLongitude - minLongitude >= 360.0;
        }

        /** True when the longitude range runs past +/-180 and has to be split in two. */
        boolean crossesAntimeridian() {
            return minLongitude < -180.0 || maxLongitude > 180.0;
        }
    }
}
