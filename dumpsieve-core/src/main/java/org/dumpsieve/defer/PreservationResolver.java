package org.dumpsieve.defer;

import org.dumpsieve.model.ClauseEntry;
import org.dumpsieve.model.PreservedIndex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 외래키가 사용하는 인덱스를 찾아 CREATE TABLE 에 남기고, 나머지를 지연 대상으로 결정한다.
 */
public class PreservationResolver {

    private final boolean deferConstraints;

    public PreservationResolver(boolean deferConstraints) {
        this.deferConstraints = deferConstraints;
    }

    /**
     * deferConstraints 가 true 면 인덱스와 제약조건을 모두 지연한다.
     * <p>
     * false 면 제약조건마다 남은 인덱스를 컬럼 수 오름차순으로 살펴, 컬럼 목록이 제약조건의
     * 컬럼 목록으로 시작하는 첫 인덱스를 보존한다. 보존된 인덱스는 다음 제약조건을 찾기 전에
     * 후보에서 빠진다. 맞는 인덱스가 없는 제약조건은 인덱스 뒤에 지연된다.
     */
    public Resolution resolve(List<ClauseEntry> indexes, List<ClauseEntry> constraints) {
        List<ClauseEntry> deferred = new ArrayList<>(indexes);
        if (deferConstraints) {
            deferred.addAll(constraints);
            return new Resolution(deferred, List.of());
        }

        List<PreservedIndex> preserved = new ArrayList<>();
        List<ClauseEntry> unsupported = new ArrayList<>();
        for (ClauseEntry constraint : constraints) {
            Optional<ClauseEntry> match = findPrefixIndex(deferred, constraint);
            if (match.isPresent()) {
                preserved.add(PreservedIndex.of(match.get(), constraint));
                deferred.remove(match.get());
            } else {
                unsupported.add(constraint);
            }
        }
        deferred.addAll(unsupported);
        return new Resolution(deferred, preserved);
    }

    // List.sort 는 안정 정렬이므로 컬럼 수가 같으면 선언 순서를 따른다
    static Optional<ClauseEntry> findPrefixIndex(List<ClauseEntry> candidates, ClauseEntry constraint) {
        List<ClauseEntry> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingInt(ClauseEntry::columnCount));
        return ordered.stream()
                .filter(index -> index.startsWith(constraint.columns()))
                .findFirst();
    }
}
