package br.com.analytics.pipeline.farmer_kpi_batch.processor;

import br.com.analytics.pipeline.farmer_kpi_batch.model.AggregationKey;
import br.com.analytics.pipeline.farmer_kpi_batch.model.FarmerMonthlyRevenue;
import br.com.analytics.pipeline.farmer_kpi_batch.model.KpiWindow;
import br.com.analytics.pipeline.farmer_kpi_batch.model.RevenueRecord;
import br.com.analytics.pipeline.farmer_kpi_batch.responsibility.ResponsibilityTimeline;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.ItemProcessor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Attributes each client-level revenue record to the farmer responsible for the client on the record date and
 * sums it into that farmer's month. Aggregates stay in memory until the load step writes them; nothing is
 * passed on to the writer.
 */
public class FarmerRevenueAggregationProcessor implements ItemProcessor<RevenueRecord, FarmerMonthlyRevenue> {

    private static final Logger log = LoggerFactory.getLogger(FarmerRevenueAggregationProcessor.class);

    private final KpiWindow window;
    private final ResponsibilityTimeline timeline;
    private final Map<AggregationKey, FarmerMonthlyRevenue> aggregatedData = new LinkedHashMap<>();

    private long unattributedCount;
    private long otherFarmerCount;

    public FarmerRevenueAggregationProcessor(KpiWindow window, ResponsibilityTimeline timeline) {
        this.window = window;
        this.timeline = timeline;
    }

    public Map<AggregationKey, FarmerMonthlyRevenue> getAggregatedData() {
        return aggregatedData;
    }

    public KpiWindow getWindow() {
        return window;
    }

    public ResponsibilityTimeline getTimeline() {
        return timeline;
    }

    public long getUnattributedCount() {
        return unattributedCount;
    }

    public long getOtherFarmerCount() {
        return otherFarmerCount;
    }

    @Override
    public @Nullable FarmerMonthlyRevenue process(RevenueRecord item) throws Exception {
        Optional<Long> farmerId = timeline.responsibleFarmer(item.clientId(), item.recordDate());
        if (farmerId.isEmpty()) {
            unattributedCount++;
            return null;
        }
        if (window.hasFarmerFilter() && !window.farmerId().equals(farmerId.get())) {
            otherFarmerCount++;
            return null;
        }

        AggregationKey key = new AggregationKey(farmerId.get(), item.recordDate().withDayOfMonth(1));
        FarmerMonthlyRevenue summary = aggregatedData.getOrDefault(key, FarmerMonthlyRevenue.empty(key));
        aggregatedData.put(key, summary.add(item));
        return null;
    }

    public void logSummary() {
        log.info("In-memory aggregation complete. {} farmer-month summaries created; "
                        + "{} records without a responsible farmer; {} records attributed to other farmers",
                aggregatedData.size(), unattributedCount, otherFarmerCount);
    }
}
