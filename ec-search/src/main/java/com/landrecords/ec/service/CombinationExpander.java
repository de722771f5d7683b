package com.landrecords.ec.service;

import com.landrecords.ec.model.District;
import com.landrecords.ec.model.Expansion;
import com.landrecords.ec.model.Hobli;
import com.landrecords.ec.model.LocationFilter;
import com.landrecords.ec.model.SearchTarget;
import com.landrecords.ec.model.Taluka;
import com.landrecords.ec.model.Village;
import com.landrecords.ec.repository.LocationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * Turns a {@link LocationFilter} into the ordered village-level target list for a batch run.
 *
 * A code given beneath an expanded level only narrows the children of the parents that
 * level resolved to. The output is deduplicated on the four codes, keeping first-seen order,
 * and depends only on the filter and the store contents.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CombinationExpander {

    private final LocationStore store;

    public Expansion expand(LocationFilter filter) {
        District district = resolveDistrict(filter);
        validateLevel("taluka", filter.isAllTaluks(), filter.getTalukaCode());
        validateLevel("hobli", filter.isAllHoblis(), filter.getHobliCode());
        validateLevel("village", filter.isAllVillages(), filter.getVillageCode());

        List<SearchTarget> candidates = new ArrayList<>();
        List<Taluka> talukas = narrow(store.listTalukas(district.code()),
                filter.isAllTaluks(), filter.getTalukaCode(), Taluka::code);

        for (Taluka taluka : talukas) {
            List<Hobli> hoblis = narrow(store.listHoblis(taluka.code()),
                    filter.isAllHoblis(), filter.getHobliCode(), Hobli::code);

            for (Hobli hobli : hoblis) {
                List<Village> villages = narrow(store.listVillages(hobli.code()),
                        filter.isAllVillages(), filter.getVillageCode(), Village::code);

                for (Village village : villages) {
                    candidates.add(new SearchTarget(
                            district.code(), taluka.code(), hobli.code(), village.code(),
                            district.name(), taluka.name(), hobli.name(), village.name()));
                }
            }
        }

        Set<SearchTarget.Key> seen = new HashSet<>();
        List<SearchTarget> unique = new ArrayList<>(candidates.size());
        for (SearchTarget target : candidates) {
            if (seen.add(target.key())) {
                unique.add(target);
            }
        }

        int duplicates = candidates.size() - unique.size();
        if (duplicates > 0) {
            log.info("Removed {} duplicate combinations", duplicates);
        }
        log.info("Filter {} expanded to {} targets", filter, unique.size());
        return new Expansion(unique, duplicates);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private District resolveDistrict(LocationFilter filter) {
        if (filter.getDistrictCode() == null) {
            throw new IllegalArgumentException("A district is required; expanding across all districts is not allowed");
        }
        return store.findDistrict(filter.getDistrictCode())
                .orElseThrow(() -> new IllegalArgumentException("Unknown district: " + filter.getDistrictCode()));
    }

    private void validateLevel(String level, boolean all, Integer code) {
        if (all && code != null) {
            throw new IllegalArgumentException(
                    "Both 'all' and a specific code (" + code + ") were given for " + level);
        }
    }

    private <T> List<T> narrow(List<T> children, boolean all, Integer code, ToIntFunction<T> codeOf) {
        if (all || code == null) {
            return children;
        }
        return children.stream().filter(c -> codeOf.applyAsInt(c) == code).toList();
    }
}
