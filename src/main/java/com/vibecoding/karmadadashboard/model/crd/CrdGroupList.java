package com.vibecoding.karmadadashboard.model.crd;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CrdGroupList {
    private List<CrdGroup> groups;
    private int totalItems;
}
