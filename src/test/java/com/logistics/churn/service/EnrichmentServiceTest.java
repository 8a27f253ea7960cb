package com.logistics.churn.service;

import com.logistics.churn.model.OrderRecord;
import com.logistics.churn.model.PartnerEnrichment;
import com.logistics.churn.model.ReportDetails;
import com.logistics.churn.model.SkuEnrichment;
import com.logistics.churn.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.logistics.churn.testutil.TestDataFactory.NOW;
import static com.logistics.churn.testutil.TestDataFactory.createOrder;
import static com.logistics.churn.testutil.TestDataFactory.createOrdersDaysAgo;
import static org.assertj.core.api.Assertions.assertThat;

class EnrichmentServiceTest {

    private EnrichmentService enrichmentService;

    @BeforeEach
    void setUp() {
        enrichmentService = new EnrichmentService(TestDataFactory.createNormalizer(TestDataFactory.createConfig()));
    }

    @Test
    void enrichPartner_mixedDirections_scoresAndPreferences() {
        List<OrderRecord> records = new ArrayList<>(createOrdersDaysAgo("P-1", "SKU-1", "WH-1", 1, 2, 3));
        records.add(createOrder("P-1", "SKU-2", "WH-2", NOW.minusDays(4)).toBuilder().direction("Cargo").build());

        PartnerEnrichment profile = enrichmentService.enrichPartner(records, "P-1", NOW);

        assertThat(profile.getOrderCount()).isEqualTo(4);
        assertThat(profile.getItemsTotal()).isEqualTo(8);
        assertThat(profile.getAvgItemsPerOrder()).isEqualTo(2.0);
        assertThat(profile.getAvgWeightPerOrder()).isEqualTo(1.5);
        assertThat(profile.getUniqueSkus()).isEqualTo(2);
        assertThat(profile.getSkuPerOrder()).isEqualTo(0.5);
        assertThat(profile.getDirectionPreference()).isEqualTo("Express/FBS");
        assertThat(profile.getMarketplacePreference()).isEqualTo("OZON");
        assertThat(profile.getWarehousePreference()).isEqualTo("WH-1");
        assertThat(profile.getOrderFrequency()).isEqualTo(0.13);
        assertThat(profile.getConcentrationRisk()).isEqualTo(88);
        assertThat(profile.getDiversificationScore()).isEqualTo(13);
        assertThat(profile.getFulfillmentScore()).isEqualTo(75);
    }

    @Test
    void enrichPartner_inactiveWithUnevenWeights_lowerFulfillment() {
        List<OrderRecord> records = List.of(
                createOrder("P-1", "SKU-1", "WH-1", NOW.minusDays(40)).toBuilder().totalWeight(1.0).build(),
                createOrder("P-1", "SKU-1", "WH-2", NOW.minusDays(41)).toBuilder().totalWeight(3.0).build());

        PartnerEnrichment profile = enrichmentService.enrichPartner(records, "P-1", NOW);

        assertThat(profile.getOrderFrequency()).isZero();
        assertThat(profile.getFulfillmentScore()).isEqualTo(45);
        // tie between warehouses goes to the first seen
        assertThat(profile.getWarehousePreference()).isEqualTo("WH-1");
    }

    @Test
    void enrichPartner_noOrders_neutralProfile() {
        PartnerEnrichment profile = enrichmentService.enrichPartner(List.of(), "P-1", NOW);

        assertThat(profile.getOrderCount()).isZero();
        assertThat(profile.getDiversificationScore()).isEqualTo(100);
        assertThat(profile.getFulfillmentScore()).isEqualTo(50);
        assertThat(profile.getDirectionPreference()).isEmpty();
    }

    @Test
    void enrichSku_reportAveragesOnlyCountPositiveValues() {
        List<OrderRecord> records = List.of(
                createOrder("P-1", "SKU-1", "WH-1", NOW.minusDays(1)).toBuilder()
                        .report(ReportDetails.builder().weight(2.0).quantity(3).build()).build(),
                createOrder("P-2", "SKU-1", "WH-1", NOW.minusDays(2)).toBuilder()
                        .report(ReportDetails.builder().weight(0.0).build()).build(),
                createOrder("P-2", "SKU-1", "WH-2", NOW.minusDays(3)),
                createOrder("P-3", "SKU-9", "WH-3", NOW.minusDays(3)));

        SkuEnrichment sku = enrichmentService.enrichSku(records, "SKU-1");

        assertThat(sku.getOrderCount()).isEqualTo(3);
        assertThat(sku.getPartnerCount()).isEqualTo(2);
        assertThat(sku.getAvgWeight()).isEqualTo(2.0);
        assertThat(sku.getAvgQty()).isEqualTo(3.0);
        assertThat(sku.getWarehousePreference()).isEqualTo("WH-1");
    }

    @Test
    void enrichSku_unknownSku_empty() {
        SkuEnrichment sku = enrichmentService.enrichSku(createOrdersDaysAgo("P-1", "SKU-1", "WH-1", 1), "SKU-X");

        assertThat(sku.getOrderCount()).isZero();
        assertThat(sku.getMarketplacePreference()).isEmpty();
    }
}
