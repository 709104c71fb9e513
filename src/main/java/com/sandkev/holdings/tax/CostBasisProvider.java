package com.sandkev.holdings.tax;

import java.util.Map;
import java.util.Optional;

/** Source of per-asset cost-basis details. Empty means the accounting data is not ready yet. */
public interface CostBasisProvider {

    Optional<Map<String, CostBasis>> details();
}
