package com.vibecoding.karmadadashboard.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 리소스 목록 응답. 항목 배열의 JSON 필드명은 종류별로 다르다 (pods, deployments, items ...)
 */
@Getter
public class ResourceList<T> {

    private final ListMeta listMeta;
    @JsonIgnore
    private final String listField;
    @JsonIgnore
    private final List<T> items;
    private final List<String> errors;

    public ResourceList(String listField, List<T> items, int totalItems, List<String> errors) {
        this.listMeta = new ListMeta(totalItems);
        this.listField = listField;
        this.items = items;
        this.errors = errors != null ? errors : new ArrayList<>();
    }

    public static <T> ResourceList<T> of(String listField, DataSelectQuery.Page<T> page) {
        return new ResourceList<>(listField, page.getItems(), page.getTotalItems(), new ArrayList<>());
    }

    @JsonAnyGetter
    public Map<String, Object> getItemsField() {
        return Collections.singletonMap(listField, items);
    }
}
