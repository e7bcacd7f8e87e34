package com.phonepe.memoria.core.store;

import com.google.common.base.Strings;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.model.CategoryItem;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.scope.Scope;
import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Referential checks every metadata store runs before applying a batch. The lookups passed in must be scope
 * filtered, which is what keeps items, resources and links of different scopes apart.
 */
@UtilityClass
public class BatchChecks {

    public static void validate(
            WriteBatch batch,
            BiPredicate<Scope, String> resourceExists,
            BiPredicate<Scope, String> itemExists,
            BiPredicate<Scope, String> categoryExists) {
        batch.getResources().forEach(r -> requireIdentity(r.getScope(), r.getId(), "resource"));
        batch.getCategories().forEach(c -> {
            requireIdentity(c.getScope(), c.getId(), "category");
            if (Strings.isNullOrEmpty(c.getName())) {
                throw MemoriaException.of(ErrorType.INVALID_INPUT, "Category " + c.getId() + " has no name");
            }
        });
        for (var item : batch.getItems()) {
            requireIdentity(item.getScope(), item.getId(), "item");
            final var resourceId = item.getResourceId();
            final var inBatch = batch.getResources()
                    .stream()
                    .anyMatch(r -> r.getId().equals(resourceId) && r.getScope().equals(item.getScope()));
            if (resourceId == null || (!inBatch && !resourceExists.test(item.getScope(), resourceId))) {
                throw MemoriaException.of(ErrorType.INVALID_INPUT,
                                          "Item %s references resource %s which is not in scope %s"
                                                  .formatted(item.getId(), resourceId, item.getScope()));
            }
        }
        for (var link : batch.getLinks()) {
            requireIdentity(link.getScope(), link.getId(), "link");
            final var categoryPresent = batch.getCategories()
                    .stream()
                    .anyMatch(c -> sameEntity(c, link))
                    || categoryExists.test(link.getScope(), link.getCategoryId());
            final var itemPresent = batch.getItems()
                    .stream()
                    .anyMatch(i -> sameEntity(i, link))
                    || itemExists.test(link.getScope(), link.getItemId());
            if (!categoryPresent || !itemPresent) {
                throw MemoriaException.of(ErrorType.INVALID_INPUT,
                                          "Link %s joins entities outside scope %s".formatted(link.getId(),
                                                                                               link.getScope()));
            }
        }
        batch.getIntentions().forEach(i -> requireIdentity(i.getScope(), "intention", "intention"));
    }

    private static boolean sameEntity(MemoryCategory category, CategoryItem link) {
        return category.getId().equals(link.getCategoryId()) && category.getScope().equals(link.getScope());
    }

    private static boolean sameEntity(MemoryItem item, CategoryItem link) {
        return item.getId().equals(link.getItemId()) && item.getScope().equals(link.getScope());
    }

    private static void requireIdentity(Scope scope, String id, String kind) {
        if (Objects.isNull(scope) || Strings.isNullOrEmpty(id)) {
            throw MemoriaException.of(ErrorType.INVALID_INPUT, "A " + kind + " needs both scope and id");
        }
    }
}
