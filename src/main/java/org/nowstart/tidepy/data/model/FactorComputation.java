package org.nowstart.tidepy.data.model;

import java.util.List;

/**
 * Output of one factor pass.
 *
 * @param records       assets that passed every gate, in symbol order
 * @param dataGaps      one diagnostic per dropped asset with missing inputs
 * @param fundingGated  assets dropped because their funding rate was negative
 */
public record FactorComputation(
        List<FactorRecord> records,
        List<CycleDiagnostic> dataGaps,
        List<String> fundingGated
) {

    public FactorComputation {
        records = List.copyOf(records);
        dataGaps = List.copyOf(dataGaps);
        fundingGated = List.copyOf(fundingGated);
    }
}
