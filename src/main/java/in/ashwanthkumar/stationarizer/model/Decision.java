package in.ashwanthkumar.stationarizer.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.EnumSet;
import java.util.Set;

/**
 * Transformations scheduled for a single series. Both flags compose, neither excludes the other.
 */
@RequiredArgsConstructor(staticName = "of")
@Getter
@EqualsAndHashCode
@ToString
public class Decision {
    public static final Decision NONE = Decision.of(false, false);

    private final boolean difference;
    private final boolean detrend;

    /**
     * @return Transformations in the order they are applied, detrending always comes first
     */
    public Set<Transformation> transformations() {
        Set<Transformation> transformations = EnumSet.noneOf(Transformation.class);
        if (detrend) {
            transformations.add(Transformation.DETREND);
        }
        if (difference) {
            transformations.add(Transformation.DIFFERENCE);
        }
        return transformations;
    }
}
