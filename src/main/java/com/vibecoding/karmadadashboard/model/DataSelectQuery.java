package com.vibecoding.karmadadashboard.model;

import io.fabric8.kubernetes.api.model.ObjectMeta;
import lombok.Getter;
import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 목록 조회의 필터 / 정렬 / 페이지 조건
 *
 * <p>쿼리 파라미터 형식:
 * <ul>
 *   <li>{@code itemsPerPage=10&page=1} (1부터 시작)</li>
 *   <li>{@code sortBy=d,creationTimestamp,a,name}</li>
 *   <li>{@code filterBy=name,nginx,namespace,default,label,app=web}</li>
 * </ul>
 */
@Getter
public class DataSelectQuery {

    public static final DataSelectQuery NONE = new DataSelectQuery(0, 0, List.of(), List.of());

    private final int itemsPerPage;
    private final int page;
    private final List<SortBy> sortBy;
    private final List<FilterBy> filterBy;

    @Value
    public static class SortBy {
        boolean ascending;
        String property;
    }

    @Value
    public static class FilterBy {
        String property;
        String value;
    }

    @Value
    public static class Page<T> {
        List<T> items;
        int totalItems;
    }

    public DataSelectQuery(int itemsPerPage, int page, List<SortBy> sortBy, List<FilterBy> filterBy) {
        this.itemsPerPage = itemsPerPage;
        this.page = page;
        this.sortBy = sortBy;
        this.filterBy = filterBy;
    }

    public static DataSelectQuery fromParams(Map<String, String> params) {
        int itemsPerPage = parseInt(params.get("itemsPerPage"));
        int page = parseInt(params.get("page"));

        List<SortBy> sorts = new ArrayList<>();
        String[] sortParts = split(params.get("sortBy"));
        for (int i = 0; i + 1 < sortParts.length; i += 2) {
            sorts.add(new SortBy(!"d".equals(sortParts[i]), sortParts[i + 1]));
        }

        List<FilterBy> filters = new ArrayList<>();
        String[] filterParts = split(params.get("filterBy"));
        for (int i = 0; i + 1 < filterParts.length; i += 2) {
            filters.add(new FilterBy(filterParts[i], filterParts[i + 1]));
        }
        return new DataSelectQuery(itemsPerPage, page, sorts, filters);
    }

    public boolean isPaginated() {
        return itemsPerPage > 0 && page > 0;
    }

    /**
     * 필터 → 전체 개수 → 정렬 (기본: 이름 오름차순) → 페이지 순서로 적용
     */
    public <T> Page<T> apply(List<T> items, Function<T, ObjectMeta> metadata) {
        List<T> filtered = items.stream()
            .filter(item -> matches(metadata.apply(item)))
            .collect(Collectors.toList());
        int total = filtered.size();

        filtered.sort(comparator(metadata));

        if (!isPaginated()) {
            return new Page<>(filtered, total);
        }
        int from = (int) Math.min((long) (page - 1) * itemsPerPage, total);
        int to = (int) Math.min((long) from + itemsPerPage, total);
        return new Page<>(new ArrayList<>(filtered.subList(from, to)), total);
    }

    private boolean matches(ObjectMeta meta) {
        for (FilterBy filter : filterBy) {
            String value = filter.getValue();
            switch (filter.getProperty()) {
                case "name":
                    if (meta == null || meta.getName() == null || !meta.getName().contains(value)) {
                        return false;
                    }
                    break;
                case "namespace":
                    if (meta == null || !value.equals(meta.getNamespace())) {
                        return false;
                    }
                    break;
                case "label":
                    String[] kv = value.split("=", 2);
                    Map<String, String> labels = meta != null ? meta.getLabels() : null;
                    if (labels == null || kv.length != 2 || !kv[1].equals(labels.get(kv[0]))) {
                        return false;
                    }
                    break;
                default:
                    // 알 수 없는 속성은 무시
                    break;
            }
        }
        return true;
    }

    private <T> Comparator<T> comparator(Function<T, ObjectMeta> metadata) {
        List<SortBy> effective = sortBy.isEmpty() ? List.of(new SortBy(true, "name")) : sortBy;
        Comparator<T> result = null;
        for (SortBy sort : effective) {
            // null 은 방향과 상관없이 마지막
            Comparator<String> order = sort.isAscending()
                ? Comparator.<String>naturalOrder()
                : Comparator.<String>reverseOrder();
            Comparator<T> next = Comparator.comparing(
                item -> property(metadata.apply(item), sort.getProperty()),
                Comparator.nullsLast(order));
            result = result == null ? next : result.thenComparing(next);
        }
        return result;
    }

    private static String property(ObjectMeta meta, String property) {
        if (meta == null) {
            return null;
        }
        switch (property) {
            case "namespace":
                return meta.getNamespace();
            case "creationTimestamp":
                // RFC3339 문자열이므로 사전순 비교가 시간순과 같다
                return meta.getCreationTimestamp();
            default:
                return meta.getName();
        }
    }

    private static int parseInt(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String[] split(String value) {
        if (value == null || value.isBlank()) {
            return new String[0];
        }
        return value.split(",");
    }
}
