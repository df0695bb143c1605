package in.ashwanthkumar.stationarizer.plugins;

import in.ashwanthkumar.stationarizer.model.ShapeWarning;

/**
 * Receives the non-fatal notices of a run. A listener that throws never aborts the run.
 */
public interface WarningListener {
    WarningListener NOOP = warning -> {
    };

    void onWarning(ShapeWarning warning);
}
