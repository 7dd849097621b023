package com.example.vrpassistant.analysis;

import com.example.vrpassistant.model.Resource;
import com.example.vrpassistant.model.Trip;
import com.example.vrpassistant.model.Visit;
import com.example.vrpassistant.model.VrpProblem;
import com.example.vrpassistant.model.VrpSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Derives structured insights from a stored solution for the assistant to narrate.
 * Stateless; missing distances and durations count as zero.
 */
@Service
public class AnalysisEngine {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisEngine.class);

    public static final String NO_SOLUTION_MESSAGE = "No VRP solution available to analyze";
    static final String NO_TRIPS_MESSAGE = "No trips found in solution";

    public AnalysisResult analyze(String aspect, VrpSolution solution, VrpProblem problem) {
        return analyze(AnalysisAspect.fromText(aspect), solution, problem);
    }

    public AnalysisResult analyze(AnalysisAspect aspect, VrpSolution solution, VrpProblem problem) {
        if (solution == null) {
            logger.debug("Analysis {} requested without a solution", aspect);
            return AnalysisResult.noSolution(aspect);
        }

        AnalysisResult.AnalysisResultBuilder result = AnalysisResult.builder()
                .aspect(aspect)
                .solutionAvailable(true);

        switch (aspect) {
            case ROUTES:
                return result.routes(analyzeRoutes(solution)).build();
            case UTILIZATION:
                return result.utilization(analyzeUtilization(solution, problem)).build();
            case CONSTRAINTS:
                return result.constraints(analyzeConstraints(solution)).build();
            case EFFICIENCY:
                return result.efficiency(analyzeEfficiency(solution)).build();
            default:
                return result
                        .routes(analyzeRoutes(solution))
                        .utilization(analyzeUtilization(solution, problem))
                        .constraints(analyzeConstraints(solution))
                        .efficiency(analyzeEfficiency(solution))
                        .build();
        }
    }

    public RouteBreakdown analyzeRoutes(VrpSolution solution) {
        List<Trip> trips = solution.getTrips();
        if (trips.isEmpty()) {
            return RouteBreakdown.noTrips();
        }

        RouteBreakdown.RouteBreakdownBuilder breakdown = RouteBreakdown.builder()
                .tripsFound(true)
                .totalRoutes(trips.size());
        for (int idx = 0; idx < trips.size(); idx++) {
            Trip trip = trips.get(idx);
            breakdown.route(RouteBreakdown.RouteStats.builder()
                    .routeId(idx)
                    .resource(trip.getResource())
                    .stops(trip.stopCount())
                    .distance(trip.getDistance())
                    .duration(trip.getDuration())
                    .jobs(trip.getVisits().stream().map(Visit::getJob).collect(Collectors.toList()))
                    .build());
        }
        return breakdown.build();
    }

    public UtilizationReport analyzeUtilization(VrpSolution solution, VrpProblem problem) {
        int declared = problem == null ? 0 : problem.getResources().size();
        List<Trip> trips = solution.getTrips();
        if (trips.isEmpty()) {
            return UtilizationReport.noTrips(declared);
        }

        UtilizationReport.UtilizationReportBuilder report = UtilizationReport.builder()
                .tripsFound(true)
                .vehiclesUsed(trips.size())
                .totalVehiclesAvailable(declared);
        for (Trip trip : trips) {
            List<Integer> capacity = problem == null ? List.of() : problem.findResource(trip.getResource())
                    .map(Resource::getCapacity)
                    .orElse(List.of());
            report.vehicle(UtilizationReport.VehicleUtilization.builder()
                    .resource(trip.getResource())
                    .capacityUsed(trip.getLoad())
                    .capacityTotal(capacity)
                    .stops(trip.stopCount())
                    .build());
        }
        return report.build();
    }

    public ConstraintReport analyzeConstraints(VrpSolution solution) {
        List<ViolationDetail> violations = extractViolations(solution);
        List<String> unassigned = solution.getUnserved();
        return ConstraintReport.builder()
                .totalViolations(violations.size())
                .violations(violations)
                .unassignedJobs(unassigned.size())
                .unassignedDetails(unassigned)
                .unassignedReasons(solution.getUnservedReasons())
                .status(violations.isEmpty() ? ConstraintReport.FEASIBLE : ConstraintReport.HAS_VIOLATIONS)
                .build();
    }

    public EfficiencyReport analyzeEfficiency(VrpSolution solution) {
        List<Trip> trips = solution.getTrips();
        if (trips.isEmpty()) {
            return EfficiencyReport.noTrips();
        }

        long totalDistance = 0;
        long totalDuration = 0;
        int totalStops = 0;
        for (Trip trip : trips) {
            totalDistance += trip.distanceOrZero();
            totalDuration += trip.durationOrZero();
            totalStops += trip.stopCount();
        }

        return EfficiencyReport.builder()
                .tripsFound(true)
                .totalDistance(totalDistance)
                .totalDuration(totalDuration)
                .totalStops(totalStops)
                .avgDistancePerStop(totalStops > 0 ? (double) totalDistance / totalStops : 0.0)
                .vehiclesUsed(trips.size())
                .build();
    }

    /**
     * Every visit carrying a non-empty violation list, in trip and visit order.
     */
    public List<ViolationDetail> extractViolations(VrpSolution solution) {
        List<ViolationDetail> violations = new ArrayList<>();
        if (solution == null) return violations;

        for (Trip trip : solution.getTrips()) {
            for (Visit visit : trip.getVisits()) {
                if (!visit.flaggedConstraints().isEmpty()) {
                    violations.add(ViolationDetail.builder()
                            .job(visit.getJob())
                            .resource(trip.getResource())
                            .violations(visit.flaggedConstraints())
                            .build());
                }
            }
        }
        return violations;
    }
}
