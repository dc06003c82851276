package com.wcoptimizer.service;

import com.wcoptimizer.dto.AbcXyzResponse;
import com.wcoptimizer.dto.AnalysisResult;
import com.wcoptimizer.dto.InsufficientDataResponse;
import com.wcoptimizer.dto.ParetoResponse;
import com.wcoptimizer.exception.InvalidParameterException;
import com.wcoptimizer.service.ClassificationService.RankedSku;
import com.wcoptimizer.service.ClassificationService.SkuValue;
import com.wcoptimizer.support.TabularFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.wcoptimizer.catalog.DatasetCategory.PRODUCTS;
import static com.wcoptimizer.catalog.DatasetCategory.SALES_TRANSACTIONS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassificationServiceTest {

    @TempDir
    Path tempDir;

    TabularFixtures fixtures;
    ClassificationService classification;

    @BeforeEach
    void setUp() {
        fixtures = new TabularFixtures(tempDir);
        classification = new ClassificationService(fixtures.store(), new AvailabilityResolver(fixtures.store()));
    }

    @AfterEach
    void tearDown() throws Exception {
        fixtures.close();
    }

    @Test
    void rankByValue_assignsAbcFromCumulativeShare() {
        List<RankedSku> ranked = ClassificationService.rankByValue(List.of(
            new SkuValue("S4", 5), new SkuValue("S1", 50), new SkuValue("S3", 15), new SkuValue("S2", 30)));

        assertThat(ranked).extracting(RankedSku::sku).containsExactly("S1", "S2", "S3", "S4");
        assertThat(ranked).extracting(RankedSku::abcClass).containsExactly('A', 'A', 'B', 'C');
        assertThat(ranked).extracting(RankedSku::cumulativePct).containsExactly(50.0, 80.0, 95.0, 100.0);
        assertThat(ranked).extracting(RankedSku::rank).containsExactly(1, 2, 3, 4);
    }

    @Test
    void rankByValue_breaksTiesBySkuAscending() {
        List<RankedSku> ranked = ClassificationService.rankByValue(List.of(
            new SkuValue("B", 10), new SkuValue("A", 10)));

        assertThat(ranked).extracting(RankedSku::sku).containsExactly("A", "B");
    }

    @Test
    void rankByValue_zeroTotalPutsEverySkuInC() {
        List<RankedSku> ranked = ClassificationService.rankByValue(List.of(
            new SkuValue("A", 0), new SkuValue("B", 0)));

        assertThat(ranked).extracting(RankedSku::abcClass).containsOnly('C');
    }

    @Test
    void abcXyz_servesProductMasterClassesWithoutSales() {
        fixtures.load(PRODUCTS,
            "product_id,product_name,unit_cost,unit_price,abc_class,xyz_class",
            "P1,Widget,1,2,A,X",
            "P2,Gadget,1,2,C,Z",
            "P3,Bolt,1,2,B,Y");

        AbcXyzResponse response = (AbcXyzResponse) classification.abcXyz(100);

        assertThat(response.getTotalSkus()).isEqualTo(3);
        assertThat(response.getSkus()).extracting(AbcXyzResponse.Entry::getSku).containsExactly("P1", "P3", "P2");
        assertThat(response.getSkus()).extracting(AbcXyzResponse.Entry::getSegment).containsExactly("AX", "BY", "CZ");
        assertThat(response.getSkus()).extracting(AbcXyzResponse.Entry::getClassificationSource)
            .containsOnly("product_master");
        assertThat(response.getSkus().get(0).getRevenue()).isNull();
        assertThat(response.getMatrix()).containsEntry("AX", 1).containsEntry("BY", 1)
            .containsEntry("CZ", 1).containsEntry("BX", 0);
    }

    @Test
    void abcXyz_masterLettersWinAndMissingLettersAreComputed() {
        fixtures.load(SALES_TRANSACTIONS,
            "transaction_date,product_id,qty_sold,total_revenue",
            "2024-05-01,A,10,400",
            "2024-05-02,A,10,400",
            "2024-05-01,B,1,100",
            "2024-05-02,B,9,100");
        fixtures.load(PRODUCTS,
            "product_id,product_name,unit_cost,unit_price,abc_class,xyz_class",
            "B,Bee,1,2,A,",
            "P9,Nine,1,2,C,X");

        AbcXyzResponse response = (AbcXyzResponse) classification.abcXyz(100);

        assertThat(response.getSkus()).extracting(AbcXyzResponse.Entry::getSku).containsExactly("A", "B", "P9");
        assertThat(response.getSkus()).extracting(AbcXyzResponse.Entry::getSegment).containsExactly("AX", "AZ", "CX");
        assertThat(response.getSkus()).extracting(AbcXyzResponse.Entry::getClassificationSource)
            .containsExactly("computed", "mixed", "product_master");
        assertThat(response.getSkus().get(1).getProductName()).isEqualTo("Bee");
        assertThat(response.getMatrix()).containsEntry("AX", 1).containsEntry("AZ", 1).containsEntry("CX", 1);
    }

    @Test
    void abcXyz_needsSalesOrClassifiedProducts() {
        fixtures.load(PRODUCTS,
            "product_id,product_name,unit_cost,unit_price",
            "P1,Widget,1,2");

        AnalysisResult result = classification.abcXyz(100);

        assertThat(result).isInstanceOf(InsufficientDataResponse.class);
        assertThat(((InsufficientDataResponse) result).getMissing()).containsExactly("sales_transactions");
    }

    @Test
    void pareto_countsSkusDrivingEightyPercentOfRevenue() {
        fixtures.load(SALES_TRANSACTIONS,
            "transaction_date,product_id,qty_sold,total_revenue",
            "2024-05-01,S1,1,50",
            "2024-05-01,S2,1,30",
            "2024-05-01,S3,1,15",
            "2024-05-01,S4,1,5");

        ParetoResponse response = (ParetoResponse) classification.pareto("Revenue");

        assertThat(response.getDimension()).isEqualTo("revenue");
        assertThat(response.getTotalSkus()).isEqualTo(4);
        assertThat(response.getSkusDriving80Pct()).isEqualTo(2);
        assertThat(response.getPctOfSkus()).isEqualTo(50.0);
        assertThat(response.getTotalValue()).isEqualTo(100.0);
        assertThat(response.getParetoData()).extracting(ParetoResponse.Entry::getAbcClass)
            .containsExactly("A", "A", "B", "C");
    }

    @Test
    void pareto_rejectsUnknownDimension() {
        assertThatThrownBy(() -> classification.pareto("margin"))
            .isInstanceOf(InvalidParameterException.class);
    }
}
