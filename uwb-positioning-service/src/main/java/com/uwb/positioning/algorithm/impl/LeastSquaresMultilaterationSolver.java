package com.uwb.positioning.algorithm.impl;

import com.uwb.positioning.algorithm.AnchorRange;
import com.uwb.positioning.algorithm.PlanarPosition;
import com.uwb.positioning.algorithm.PositionSolver;
import com.uwb.positioning.config.UwbProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Linearised multilateration solved through the 2x2 normal equations.
 *
 * <p>MATHEMATICAL FOUNDATION:
 *
 * <pre>
 * For each anchor i:            (x - xi)² + (y - yi)² = di²
 * Subtracting reference j:      2(xi - xj)x + 2(yi - yj)y = (dj² - di²) + (xi² + yi²) - (xj² + yj²)
 * In matrix form:               A·p = b
 * Normal equations:             (AᵀA)·p = Aᵀb
 * Solution:                     p = (AᵀA)⁻¹ Aᵀb, rejected when |det(AᵀA)| is below epsilon
 * </pre>
 *
 * The last anchor of the list is the reference. With three anchors the system is square and the
 * result is the exact algebraic intersection; with four it is the least-squares fit. No iterative
 * refinement and no clamping to the anchor rectangle.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LeastSquaresMultilaterationSolver implements PositionSolver {

    private final UwbProperties properties;

    @Override
    public Optional<PlanarPosition> solve(List<AnchorRange> anchors) {
        if (anchors == null || anchors.size() < MIN_ANCHORS) {
            return Optional.empty();
        }

        int rows = anchors.size() - 1;
        AnchorRange reference = anchors.get(rows);
        double referenceNorm = square(reference.x()) + square(reference.y());
        double referenceRange = square(reference.distance());

        double[][] coefficients = new double[rows][2];
        double[] constants = new double[rows];

        // Each row subtracts the reference circle from anchor i's circle
        for (int i = 0; i < rows; i++) {
            AnchorRange anchor = anchors.get(i);
            coefficients[i][0] = 2.0 * (anchor.x() - reference.x());
            coefficients[i][1] = 2.0 * (anchor.y() - reference.y());
            constants[i] = (referenceRange - square(anchor.distance()))
                + (square(anchor.x()) + square(anchor.y()))
                - referenceNorm;
        }

        RealMatrix a = new Array2DRowRealMatrix(coefficients, false);
        RealVector b = new ArrayRealVector(constants, false);
        RealMatrix normal = a.transpose().multiply(a);
        RealVector projected = a.transpose().operate(b);

        LUDecomposition decomposition = new LUDecomposition(normal);
        double determinant = decomposition.getDeterminant();
        if (Math.abs(determinant) < properties.getSolver().getDeterminantEpsilon()) {
            log.debug("Anchor geometry is singular (det={}), skipping solve", determinant);
            return Optional.empty();
        }

        RealVector solution;
        try {
            solution = decomposition.getSolver().solve(projected);
        } catch (SingularMatrixException e) {
            log.debug("Normal equations could not be inverted for {} anchors: {}", anchors.size(), e.getMessage());
            return Optional.empty();
        }

        PlanarPosition position = new PlanarPosition(solution.getEntry(0), solution.getEntry(1));
        if (!position.isFinite()) {
            log.debug("Solver produced a non-finite position from {} anchors", anchors.size());
            return Optional.empty();
        }
        return Optional.of(position);
    }

    @Override
    public String getName() {
        return "least_squares_multilateration";
    }

    private static double square(double value) {
        return value * value;
    }
}
