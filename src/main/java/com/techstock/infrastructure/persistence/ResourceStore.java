package com.techstock.infrastructure.persistence;

import com.techstock.domain.exception.DatabaseException;
import com.techstock.domain.model.DimensionCount;
import com.techstock.domain.model.ResourceCriterion;
import com.techstock.domain.model.ResourceDimension;
import com.techstock.domain.model.ResourceField;
import com.techstock.domain.model.ResourcePage;
import com.techstock.domain.model.ResourceQuery;
import com.techstock.domain.model.SortDirection;
import com.techstock.infrastructure.persistence.entity.ResourceEntity;
import com.techstock.infrastructure.persistence.entity.ResourceTagEntity;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.AbstractQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Executes compiled {@link ResourceQuery} descriptors.
 *
 * Predicates are built with the Criteria API, so every filter, search and
 * tag value reaches the database as a bound parameter; LIKE wildcards in
 * user input are escaped and match literally.
 *
 * The page and the total are produced from the same criteria list, which
 * keeps them consistent with each other.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ResourceStore {

    private static final char LIKE_ESCAPE = '\\';

    private final EntityManager entityManager;

    /**
     * Returns one page of matching resources plus the total match count
     * (unaffected by page and size).
     */
    public ResourcePage query(ResourceQuery query) {
        if (query.getOffset() > Integer.MAX_VALUE) {
            // past any reachable row; the window cannot be expressed as a JPA int offset
            return new ResourcePage(List.of(), count(query.getCriteria()));
        }
        try {
            CriteriaBuilder cb = entityManager.getCriteriaBuilder();

            CriteriaQuery<ResourceEntity> select = cb.createQuery(ResourceEntity.class);
            Root<ResourceEntity> root = select.from(ResourceEntity.class);
            select.select(root)
                    .where(toPredicates(query.getCriteria(), root, select, cb))
                    .orderBy(toOrders(query, root, cb));

            List<ResourceEntity> records = entityManager.createQuery(select)
                    .setFirstResult((int) query.getOffset())
                    .setMaxResults(query.getSize())
                    .getResultList();

            long total = count(query.getCriteria());

            log.debug("Resource query matched {} rows, returning {} (page {}, size {})",
                    total, records.size(), query.getPage(), query.getSize());

            return new ResourcePage(records, total);

        } catch (PersistenceException e) {
            log.error("Resource query failed: {}", e.getMessage(), e);
            throw new DatabaseException("Failed to query resources", e);
        }
    }

    /**
     * Number of resources satisfying all criteria.
     */
    public long count(List<ResourceCriterion> criteria) {
        try {
            CriteriaBuilder cb = entityManager.getCriteriaBuilder();
            CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
            Root<ResourceEntity> root = countQuery.from(ResourceEntity.class);
            countQuery.select(cb.count(root))
                    .where(toPredicates(criteria, root, countQuery, cb));
            return entityManager.createQuery(countQuery).getSingleResult();

        } catch (PersistenceException e) {
            log.error("Resource count failed: {}", e.getMessage(), e);
            throw new DatabaseException("Failed to count resources", e);
        }
    }

    /**
     * {@code GROUP BY dimension, COUNT(*)} restricted to the given criteria,
     * ordered by count descending then label. Null labels become "Unknown" and
     * are merged with a stored "Unknown" value.
     */
    public List<DimensionCount> countBy(ResourceDimension dimension, List<ResourceCriterion> criteria) {
        try {
            CriteriaBuilder cb = entityManager.getCriteriaBuilder();
            CriteriaQuery<Tuple> groupQuery = cb.createTupleQuery();
            Root<ResourceEntity> root = groupQuery.from(ResourceEntity.class);

            Path<String> label = root.get(dimension.getField().getAttribute());
            Expression<Long> count = cb.count(root);

            groupQuery.multiselect(label, count)
                    .where(toPredicates(criteria, root, groupQuery, cb))
                    .groupBy(label)
                    .orderBy(cb.desc(count), cb.asc(label));

            List<DimensionCount> result = new ArrayList<>();
            for (Tuple row : entityManager.createQuery(groupQuery).getResultList()) {
                String value = row.get(0, String.class);
                result.add(new DimensionCount(
                        value != null ? value : ResourceDimension.UNKNOWN_LABEL,
                        row.get(1, Long.class)));
            }
            return DimensionCount.mergeByLabel(result);

        } catch (PersistenceException e) {
            log.error("Grouped count by {} failed: {}", dimension, e.getMessage(), e);
            throw new DatabaseException("Failed to count resources by " + dimension, e);
        }
    }

    private Predicate[] toPredicates(List<ResourceCriterion> criteria,
                                     Root<ResourceEntity> root,
                                     AbstractQuery<?> query,
                                     CriteriaBuilder cb) {
        List<Predicate> predicates = new ArrayList<>(criteria.size());
        for (ResourceCriterion criterion : criteria) {
            predicates.add(toPredicate(criterion, root, query, cb));
        }
        return predicates.toArray(new Predicate[0]);
    }

    private Predicate toPredicate(ResourceCriterion criterion,
                                  Root<ResourceEntity> root,
                                  AbstractQuery<?> query,
                                  CriteriaBuilder cb) {
        if (criterion instanceof ResourceCriterion.Equals equals) {
            return cb.equal(root.get(equals.getField().getAttribute()), equals.getValue());
        }
        if (criterion instanceof ResourceCriterion.ContainsIgnoreCase contains) {
            return containsIgnoreCase(root.get(contains.getField().getAttribute()), contains.getValue(), cb);
        }
        if (criterion instanceof ResourceCriterion.AnyContainsIgnoreCase anyContains) {
            List<Predicate> alternatives = new ArrayList<>();
            for (ResourceField field : anyContains.getFields()) {
                alternatives.add(containsIgnoreCase(root.get(field.getAttribute()), anyContains.getValue(), cb));
            }
            return cb.or(alternatives.toArray(new Predicate[0]));
        }
        if (criterion instanceof ResourceCriterion.AnyTag anyTag) {
            return anyTag(anyTag, root, query, cb);
        }
        throw new IllegalArgumentException("Unsupported criterion: " + criterion.getClass().getName());
    }

    /**
     * EXISTS (SELECT 1 FROM resource_tag t WHERE t.resource_id = r.id
     *         AND ((t.key = ? AND lower(t.value) LIKE ?) OR ...))
     */
    private Predicate anyTag(ResourceCriterion.AnyTag anyTag,
                             Root<ResourceEntity> root,
                             AbstractQuery<?> query,
                             CriteriaBuilder cb) {
        if (anyTag.getTags().isEmpty()) {
            return cb.conjunction();
        }
        Subquery<Long> tags = query.subquery(Long.class);
        Root<ResourceTagEntity> tag = tags.from(ResourceTagEntity.class);

        List<Predicate> alternatives = new ArrayList<>();
        for (ResourceCriterion.TagMatch match : anyTag.getTags()) {
            alternatives.add(cb.and(
                    cb.equal(tag.get("tagKey"), match.getKey()),
                    containsIgnoreCase(tag.get("tagValue"), match.getValue(), cb)));
        }

        tags.select(tag.get("resourceId"))
                .where(cb.equal(tag.get("resourceId"), root.get("id")),
                        cb.or(alternatives.toArray(new Predicate[0])));
        return cb.exists(tags);
    }

    private List<Order> toOrders(ResourceQuery query, Root<ResourceEntity> root, CriteriaBuilder cb) {
        List<Order> orders = new ArrayList<>();

        String term = query.getRelevanceTerm();
        if (term != null && !term.isEmpty()) {
            String lowered = term.toLowerCase(Locale.ROOT);
            Expression<String> name = cb.lower(root.get("name"));
            Expression<Integer> bucket = cb.<Integer>selectCase()
                    .when(cb.equal(name, lowered), cb.literal(1))
                    .when(cb.like(name, escapeLike(lowered) + "%", LIKE_ESCAPE), cb.literal(2))
                    .when(cb.like(name, "%" + escapeLike(lowered) + "%", LIKE_ESCAPE), cb.literal(3))
                    .otherwise(cb.literal(4));
            orders.add(cb.asc(bucket));
        }

        Path<?> sortPath = root.get(query.getSortField().getAttribute());
        orders.add(query.getSortDirection() == SortDirection.DESC ? cb.desc(sortPath) : cb.asc(sortPath));

        // Stable paging when the sort column has duplicates
        if (query.getSortField() != ResourceField.ID) {
            orders.add(cb.asc(root.get("id")));
        }
        return orders;
    }

    private Predicate containsIgnoreCase(Expression<String> expression, String value, CriteriaBuilder cb) {
        String pattern = "%" + escapeLike(value.toLowerCase(Locale.ROOT)) + "%";
        return cb.like(cb.lower(expression), pattern, LIKE_ESCAPE);
    }

    static String escapeLike(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
