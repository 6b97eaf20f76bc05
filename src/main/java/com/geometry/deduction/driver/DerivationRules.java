package com.geometry.deduction.driver;

import com.geometry.deduction.construction.ConstructionLayer;
import com.geometry.deduction.core.model.Altitude;
import com.geometry.deduction.core.model.Angle;
import com.geometry.deduction.core.model.AngleBisector;
import com.geometry.deduction.core.model.ObjectKind;
import com.geometry.deduction.core.model.Segment;
import com.geometry.deduction.core.model.Triangle;
import com.geometry.deduction.theorem.Theorems;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The built-in rule table, in the order rules are tried for each kind of target.
 */
public final class DerivationRules {

    private DerivationRules() {
    }

    public static Map<ObjectKind, List<DerivationRule>> standard(ConstructionLayer layer, Theorems theorems) {
        Map<ObjectKind, List<DerivationRule>> rules = new EnumMap<>(ObjectKind.class);
        rules.put(ObjectKind.SEGMENT, List.of(
                DerivationRule.of("subsegmentSum", target -> theorems.subsegmentSum(((Segment) target).line())),
                DerivationRule.of("triangleAreaEquivalence", target -> areaEquivalence(layer, theorems, (Segment) target)),
                DerivationRule.of("angleBisectorRatio", target -> bisectorRatio(layer, theorems, (Segment) target)),
                DerivationRule.of("pythagorean", target -> pythagorean(layer, theorems, (Segment) target))));
        rules.put(ObjectKind.ANGLE, List.of(
                DerivationRule.of("explementaryPairing", target -> ((Angle) target).pairWithExplementary()),
                DerivationRule.of("straightAngle", target -> {
                    Angle angle = (Angle) target;
                    theorems.straightAngle(angle.getRay1().line());
                    theorems.straightAngle(angle.getRay2().line());
                }),
                DerivationRule.of("triangleAngleSum", target -> angleSum(layer, theorems, (Angle) target))));
        rules.put(ObjectKind.TRIANGLE, List.of(
                DerivationRule.of("heronsFormula", target -> theorems.heronsFormula((Triangle) target)),
                DerivationRule.of("areaByAltitude", target -> {
                    Triangle triangle = (Triangle) target;
                    for (Altitude altitude : triangle.altitudes()) {
                        theorems.triangleAreaUsingAltitude(triangle, altitude);
                    }
                })));
        return Collections.unmodifiableMap(rules);
    }

    /** Every area expression of each triangle the segment is an altitude of. */
    private static void areaEquivalence(ConstructionLayer layer, Theorems theorems, Segment segment) {
        for (Triangle triangle : layer.registry().elements(Triangle.class)) {
            if (!triangle.isAltitude(segment)) {
                continue;
            }
            theorems.heronsFormula(triangle);
            for (Altitude altitude : triangle.altitudes()) {
                theorems.triangleAreaUsingAltitude(triangle, altitude);
            }
        }
    }

    private static void bisectorRatio(ConstructionLayer layer, Theorems theorems, Segment segment) {
        for (Triangle triangle : layer.registry().elements(Triangle.class)) {
            for (AngleBisector bisector : triangle.angleBisectors()) {
                boolean touches = segment.hasEndpoint(bisector.vertex()) || segment.hasEndpoint(bisector.foot());
                if (touches && segment.line() != bisector.segment().line()) {
                    theorems.angleBisector(triangle, bisector);
                }
            }
        }
    }

    private static void pythagorean(ConstructionLayer layer, Theorems theorems, Segment segment) {
        for (Triangle triangle : layer.registry().elements(Triangle.class)) {
            if (triangle.hasSide(segment) && triangle.rightAngleVertex().isPresent()) {
                theorems.pythagorean(triangle);
            }
        }
    }

    private static void angleSum(ConstructionLayer layer, Theorems theorems, Angle angle) {
        for (Triangle triangle : layer.registry().elements(Triangle.class)) {
            if (triangle.hasAngle(angle) || triangle.hasAngle(angle.explementary())) {
                theorems.triangleAngleSum(triangle);
            }
        }
    }
}
