package com.example.lawrag.application.service;

import com.example.lawrag.controller.exception.BusinessException;
import com.example.lawrag.domain.dto.CollectionStats;
import com.example.lawrag.domain.model.SupportedCountry;
import com.example.lawrag.domain.port.VectorStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * One collection per supported country, all created with the same schema: a dense vector of the
 * configured dimension plus a sparse vector, with keyword payload fields for filtering.
 */
@Service
public class CollectionService {

    private static final Logger log = LoggerFactory.getLogger(CollectionService.class);

    public static final String COLLECTION_PREFIX = "laws_";

    private final VectorStore vectorStore;
    private final int denseDimension;

    public CollectionService(
            VectorStore vectorStore,
            @Value("${lawrag.embedding.dimensions:1024}") int denseDimension
    ) {
        this.vectorStore = vectorStore;
        this.denseDimension = denseDimension;
    }

    public static String collectionName(String country) {
        return COLLECTION_PREFIX + country;
    }

    public static SupportedCountry requireCountry(String code) {
        return SupportedCountry.fromCode(code)
                .orElseThrow(() -> new BusinessException(HttpStatus.BAD_REQUEST, "Unsupported country: " + code));
    }

    public String ensureCountryCollection(SupportedCountry country) {
        String name = collectionName(country.code());
        if (vectorStore.createCollection(name, denseDimension)) {
            log.info("event=collection_created country={} collection={} dims={}", country.code(), name, denseDimension);
        }
        return name;
    }

    public Optional<CollectionStats> stats(SupportedCountry country) {
        String name = collectionName(country.code());
        if (!vectorStore.collectionExists(name)) {
            return Optional.empty();
        }
        long points = vectorStore.countPoints(name);
        return Optional.of(CollectionStats.builder()
                .country(country.code())
                .countryName(country.getDisplayName())
                .collectionName(name)
                .status(points > 0 ? "active" : "empty")
                .pointsCount(points)
                .denseDimension(denseDimension)
                .sparseEnabled(true)
                .build());
    }

    public List<CollectionStats> listCountryCollections() {
        List<CollectionStats> out = new ArrayList<>();
        for (SupportedCountry country : SupportedCountry.values()) {
            out.add(stats(country).orElseGet(() -> CollectionStats.builder()
                    .country(country.code())
                    .countryName(country.getDisplayName())
                    .collectionName(collectionName(country.code()))
                    .status("not_initialized")
                    .pointsCount(0)
                    .denseDimension(denseDimension)
                    .sparseEnabled(true)
                    .build()));
        }
        return out;
    }

    public boolean deleteCountryCollection(SupportedCountry country) {
        boolean deleted = vectorStore.deleteCollection(collectionName(country.code()));
        log.info("event=collection_deleted country={} deleted={}", country.code(), deleted);
        return deleted;
    }

    public String resetCountryCollection(SupportedCountry country) {
        vectorStore.deleteCollection(collectionName(country.code()));
        String name = ensureCountryCollection(country);
        log.info("event=collection_reset country={} collection={}", country.code(), name);
        return name;
    }

    public boolean hasPoints(SupportedCountry country) {
        String name = collectionName(country.code());
        return vectorStore.collectionExists(name) && vectorStore.countPoints(name) > 0;
    }
}
