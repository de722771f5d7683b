package com.landrecords.ec.repository;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.landrecords.ec.model.CrawlSummary;
import com.landrecords.ec.model.District;
import com.landrecords.ec.model.Hobli;
import com.landrecords.ec.model.LocationMatch;
import com.landrecords.ec.model.Taluka;
import com.landrecords.ec.model.Village;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocationStoreTest {

    private LocationStore store;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        store = new LocationStore(new JdbcTemplate(dataSource), JsonMapper.builder().findAndAddModules().build());
        store.ensureSchema();
    }

    private void seedBranch() {
        store.upsertDistrict(new District(10, "Bengaluru Urban", "ಬೆಂಗಳೂರು ನಗರ"));
        store.upsertTaluka(new Taluka(20, "Anekal", null, 10));
        store.upsertHobli(new Hobli(30, "Attibele", null, 20));
        store.upsertVillage(new Village(40, "Yadavanahalli", null, 30, false));
    }

    @Nested
    @DisplayName("upserts")
    class Upserts {

        @Test
        void storesFullBranch() {
            seedBranch();

            assertThat(store.counts()).containsEntry("district", 1L)
                    .containsEntry("taluka", 1L)
                    .containsEntry("hobli", 1L)
                    .containsEntry("village", 1L);
        }

        @Test
        void reupsertReplacesInsteadOfDuplicating() {
            seedBranch();
            store.upsertDistrict(new District(10, "Bangalore Urban", null));
            store.upsertVillage(new Village(40, "Yadavanahalli (renamed)", null, 30, true));

            assertThat(store.listDistricts()).extracting(District::name).containsExactly("Bangalore Urban");
            assertThat(store.listVillages(30)).singleElement()
                    .satisfies(v -> {
                        assertThat(v.name()).isEqualTo("Yadavanahalli (renamed)");
                        assertThat(v.urban()).isTrue();
                    });
        }

        @Test
        void sameVillageCodeUnderTwoHoblisIsTwoRows() {
            seedBranch();
            store.upsertHobli(new Hobli(31, "Sarjapura", null, 20));
            store.upsertVillage(new Village(40, "Yadavanahalli", null, 31, false));

            assertThat(store.listVillages(null)).hasSize(2);
        }

        @Test
        void rejectsTalukaWithUnknownDistrict() {
            assertThatThrownBy(() -> store.upsertTaluka(new Taluka(20, "Anekal", null, 99)))
                    .isInstanceOf(ReferentialIntegrityException.class)
                    .hasMessageContaining("99");
            assertThat(store.counts()).containsEntry("taluka", 0L);
        }

        @Test
        void rejectsVillageWithUnknownHobli() {
            seedBranch();

            assertThatThrownBy(() -> store.upsertVillage(new Village(41, "Orphan", null, 77, false)))
                    .isInstanceOf(ReferentialIntegrityException.class);
        }
    }

    @Nested
    @DisplayName("listings")
    class Listings {

        @Test
        void ordersByNameThenCode() {
            store.upsertDistrict(new District(3, "Mysuru", null));
            store.upsertDistrict(new District(2, "Belagavi", null));
            store.upsertDistrict(new District(1, "Mysuru", null));

            assertThat(store.listDistricts()).extracting(District::code).containsExactly(2, 1, 3);
        }

        @Test
        void filtersByParent() {
            seedBranch();
            store.upsertDistrict(new District(11, "Mandya", null));
            store.upsertTaluka(new Taluka(21, "Maddur", null, 11));

            assertThat(store.listTalukas(10)).extracting(Taluka::code).containsExactly(20);
            assertThat(store.listTalukas(null)).hasSize(2);
            assertThat(store.listHoblis(21)).isEmpty();
        }

        @Test
        void findsByCode() {
            seedBranch();

            assertThat(store.findDistrict(10)).map(District::name).contains("Bengaluru Urban");
            assertThat(store.findTaluka(20)).isPresent();
            assertThat(store.findHobli(30)).map(Hobli::talukaCode).contains(20);
            assertThat(store.findDistrict(12)).isEmpty();
        }
    }

    @Nested
    @DisplayName("location search")
    class Search {

        @Test
        void matchesNamePartIgnoringCaseWithParentNames() {
            seedBranch();
            store.upsertHobli(new Hobli(31, "Sarjapura", null, 20));

            assertThat(store.search("ANE")).singleElement().satisfies(m -> {
                assertThat(m.level()).isEqualTo(LocationMatch.Level.TALUKA);
                assertThat(m.code()).isEqualTo(20);
                assertThat(m.districtCode()).isEqualTo(10);
                assertThat(m.districtName()).isEqualTo("Bengaluru Urban");
                assertThat(m.talukaName()).isNull();
            });
            assertThat(store.search("pura")).extracting(LocationMatch::code).containsExactly(31);
        }

        @Test
        void matchesCodeAcrossLevels() {
            seedBranch();

            assertThat(store.search(" 30 ")).singleElement().satisfies(m -> {
                assertThat(m.level()).isEqualTo(LocationMatch.Level.HOBLI);
                assertThat(m.name()).isEqualTo("Attibele");
                assertThat(m.talukaName()).isEqualTo("Anekal");
                assertThat(m.districtName()).isEqualTo("Bengaluru Urban");
            });
            assertThat(store.search("10")).extracting(LocationMatch::level)
                    .containsExactly(LocationMatch.Level.DISTRICT);
        }

        @Test
        void resultsInHierarchyOrder() {
            store.upsertDistrict(new District(10, "Bengaluru Urban", null));
            store.upsertTaluka(new Taluka(20, "Bengaluru North", null, 10));
            store.upsertHobli(new Hobli(30, "Bengaluru East", null, 20));

            assertThat(store.search("bengaluru")).extracting(LocationMatch::level).containsExactly(
                    LocationMatch.Level.DISTRICT, LocationMatch.Level.TALUKA, LocationMatch.Level.HOBLI);
        }

        @Test
        void wildcardsAndBlankTermsMatchNothing() {
            seedBranch();

            assertThat(store.search("%")).isEmpty();
            assertThat(store.search("_")).isEmpty();
            assertThat(store.search("  ")).isEmpty();
            assertThat(store.search(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("crawl metadata")
    class Metadata {

        @Test
        void noSummaryBeforeFirstCrawl() {
            assertThat(store.lastCrawlSummary()).isEmpty();
        }

        @Test
        void lastSummaryWins() {
            LocalDateTime t = LocalDateTime.of(2024, 5, 1, 3, 0);
            store.recordCrawlSummary(CrawlSummary.builder().startedAt(t).completedAt(t.plusHours(1))
                    .districtsIngested(31).build());
            store.recordCrawlSummary(CrawlSummary.builder().startedAt(t).completedAt(t.plusHours(2))
                    .districtsIngested(31).villagesIngested(29000).hobliFetchesSkipped(2).build());

            assertThat(store.lastCrawlSummary()).hasValueSatisfying(s -> {
                assertThat(s.getVillagesIngested()).isEqualTo(29000);
                assertThat(s.totalSkipped()).isEqualTo(2);
                assertThat(s.getCompletedAt()).isEqualTo(t.plusHours(2));
            });
        }
    }
}
