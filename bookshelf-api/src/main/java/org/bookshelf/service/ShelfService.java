package org.bookshelf.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.bookshelf.model.entity.BookshelfUserEntity;
import org.bookshelf.model.entity.ShelfEntity;
import org.bookshelf.model.enums.ShelfType;
import org.bookshelf.repository.ShelfRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ShelfService {

    private final ShelfRepository shelfRepository;

    public ShelfEntity getOrCreateShelf(BookshelfUserEntity user, ShelfType type) {
        return shelfRepository.findByUserIdAndIdentifier(user.getId(), type.getIdentifier())
                .orElseGet(() -> createDefaultShelf(user, type));
    }

    public Optional<ShelfEntity> findShelf(BookshelfUserEntity user, String identifier) {
        if (StringUtils.isBlank(identifier)) {
            return Optional.empty();
        }
        return shelfRepository.findByUserIdAndIdentifier(user.getId(), identifier.trim());
    }

    /**
     * Picks the shelf an imported row belongs on. Known reading states map onto the built-in shelves, other
     * names onto a user shelf with that identifier, and anything else falls back on whether the row was
     * finished.
     */
    public ShelfEntity resolveImportShelf(BookshelfUserEntity user, String sourceShelf, boolean finished) {
        Optional<ShelfType> type = ShelfType.fromSourceName(sourceShelf);
        if (type.isPresent()) {
            return getOrCreateShelf(user, type.get());
        }
        Optional<ShelfEntity> custom = findShelf(user, sourceShelf);
        if (custom.isPresent()) {
            return custom.get();
        }
        return getOrCreateShelf(user, finished ? ShelfType.READ : ShelfType.TO_READ);
    }

    private ShelfEntity createDefaultShelf(BookshelfUserEntity user, ShelfType type) {
        ShelfEntity shelf = shelfRepository.save(ShelfEntity.builder()
                .user(user)
                .identifier(type.getIdentifier())
                .name(type.getDisplayName())
                .editable(false)
                .build());
        log.info("Created default shelf '{}' for userId={}", type.getIdentifier(), user.getId());
        return shelf;
    }
}
