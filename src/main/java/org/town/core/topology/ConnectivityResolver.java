package org.town.core.topology;

import org.town.core.model.Direction;
import org.town.core.model.TileCatalog;
import org.town.core.model.TileDefinition;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Подбор дорожного тайла по набору направлений.
 *
 * Кандидаты - наземные тайлы с дорожной связностью, в порядке каталога.
 * Первое точное совпадение выигрывает, так что результат детерминирован.
 */
public class ConnectivityResolver {

    private final List<TileDefinition> candidates;

    public ConnectivityResolver(TileCatalog catalog) {
        this.candidates = new ArrayList<>(catalog.roadTiles());
    }

    /** Пустой результат - штатная ситуация: вызывающий пропускает клетку и пишет ошибку. */
    public Optional<TileDefinition> findExactMatch(Set<Direction> required) {
        if (required == null) return Optional.empty();
        for (TileDefinition t : candidates) {
            if (t.connects().equals(required)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /**
     * Тайл, у которого к текущим связям добавлено newDirection.
     * Если направление уже есть, апгрейд не нужен -> empty.
     */
    public Optional<TileDefinition> upgrade(TileDefinition current, Direction newDirection) {
        if (current == null || newDirection == null) return Optional.empty();
        if (current.connectsTo(newDirection)) return Optional.empty();

        Set<Direction> wanted = current.connects().isEmpty()
                ? EnumSet.noneOf(Direction.class)
                : EnumSet.copyOf(current.connects());
        wanted.add(newDirection);
        return findExactMatch(wanted);
    }

    public List<TileDefinition> candidates() {
        return List.copyOf(candidates);
    }
}
