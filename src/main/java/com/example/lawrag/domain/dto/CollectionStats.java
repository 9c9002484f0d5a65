package com.example.lawrag.domain.dto;

import lombok.Builder;
import lombok.Getter;

@Builder
@Getter
public class CollectionStats {
    private String country;
    private String countryName;
    private String collectionName;
    private String status;
    private long pointsCount;
    private int denseDimension;
    private boolean sparseEnabled;
}
