package app.kartoteka.exchange.store;

import app.kartoteka.exchange.domain.ClientEntity;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

final class ClientSpecifications {

    private static final List<String> SEARCH_ATTRIBUTES = List.of(
            "displayName", "companyName", "nip", "regon", "email", "city"
    );

    private static final char LIKE_ESCAPE = '\\';

    private ClientSpecifications() {
    }

    static Specification<ClientEntity> liveInTenant(UUID tenantId) {
        return (root, query, cb) -> cb.and(
                cb.equal(root.get("tenantId"), tenantId),
                cb.isNull(root.get("deletedAt"))
        );
    }

    static Specification<ClientEntity> matching(UUID tenantId, ExportFilter filter) {
        Specification<ClientEntity> spec = liveInTenant(tenantId);
        if (filter == null) {
            return spec;
        }
        if (filter.statuses() != null && !filter.statuses().isEmpty()) {
            spec = spec.and((root, query, cb) -> root.get("status").in(filter.statuses()));
        }
        if (filter.createdFrom() != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("createdAt"), filter.createdFrom()));
        }
        if (filter.createdTo() != null) {
            spec = spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.get("createdAt"), filter.createdTo()));
        }
        if (filter.search() != null && !filter.search().isBlank()) {
            spec = spec.and(search(filter.search()));
        }
        if (filter.tagIds() != null && !filter.tagIds().isEmpty()) {
            spec = spec.and(anyTag(filter.tagIds()));
        }
        if (filter.customFields() != null) {
            for (Map.Entry<String, String> entry : filter.customFields().entrySet()) {
                spec = spec.and(customFieldEquals(entry.getKey(), entry.getValue()));
            }
        }
        return spec;
    }

    private static Specification<ClientEntity> search(String term) {
        String pattern = containsPattern(term);
        return (root, query, cb) -> {
            List<Predicate> anyOf = new ArrayList<>();
            for (String attribute : SEARCH_ATTRIBUTES) {
                anyOf.add(cb.like(cb.lower(root.get(attribute)), pattern, LIKE_ESCAPE));
            }
            return cb.or(anyOf.toArray(Predicate[]::new));
        };
    }

    static String containsPattern(String term) {
        String lowered = term.trim().toLowerCase(Locale.ROOT);
        StringBuilder pattern = new StringBuilder(lowered.length() + 2).append('%');
        for (char c : lowered.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                pattern.append(LIKE_ESCAPE);
            }
            pattern.append(c);
        }
        return pattern.append('%').toString();
    }

    // jsonb operators are not part of JPQL; the Postgres functions are passed through by Hibernate.
    private static Specification<ClientEntity> anyTag(List<String> tagIds) {
        return (root, query, cb) -> {
            List<Predicate> anyOf = new ArrayList<>();
            for (String tagId : tagIds) {
                Expression<Boolean> present = cb.function("jsonb_exists", Boolean.class, root.get("tags"), cb.literal(tagId));
                anyOf.add(cb.isTrue(present));
            }
            return cb.or(anyOf.toArray(Predicate[]::new));
        };
    }

    private static Specification<ClientEntity> customFieldEquals(String key, String value) {
        return (root, query, cb) -> {
            Expression<String> stored = cb.function(
                    "jsonb_extract_path_text", String.class, root.get("customFields"), cb.literal(key)
            );
            return value == null ? cb.isNull(stored) : cb.equal(stored, value);
        };
    }
}
