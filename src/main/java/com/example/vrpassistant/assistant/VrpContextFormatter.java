package com.example.vrpassistant.assistant;

import com.example.vrpassistant.model.Job;
import com.example.vrpassistant.model.Location;
import com.example.vrpassistant.model.Resource;
import com.example.vrpassistant.model.Score;
import com.example.vrpassistant.model.SessionContext;
import com.example.vrpassistant.model.SolutionViolation;
import com.example.vrpassistant.model.Trip;
import com.example.vrpassistant.model.VrpProblem;
import com.example.vrpassistant.model.VrpSolution;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a session's problem and solution as the hidden context block that precedes the
 * user's message.
 */
@Component
public class VrpContextFormatter {

    static final int MAX_LISTED_JOBS = 10;
    static final int MAX_LISTED_VIOLATIONS = 5;

    public String format(SessionContext context) {
        List<String> parts = new ArrayList<>();
        parts.add("<VRP_CONTEXT>");
        appendProblem(parts, context.getProblem());
        context.solution().ifPresent(solution -> appendSolution(parts, solution));
        parts.add("\n</VRP_CONTEXT>");
        return String.join("\n", parts);
    }

    private void appendProblem(List<String> parts, VrpProblem problem) {
        List<Job> jobs = problem.getJobs();
        List<Resource> resources = problem.getResources();

        parts.add("\n## Problem Overview");
        parts.add("- Total Jobs: " + jobs.size());
        parts.add("- Total Resources/Vehicles: " + resources.size());

        if (!jobs.isEmpty()) {
            parts.add("\n## Jobs");
            for (int idx = 0; idx < Math.min(MAX_LISTED_JOBS, jobs.size()); idx++) {
                Job job = jobs.get(idx);
                String jobId = job.getName() != null ? job.getName() : "job_" + idx;
                int duration = job.getDuration() == null ? 0 : job.getDuration();
                parts.add(String.format(Locale.ROOT, "- %s: %s, duration=%ds", jobId, describe(job.getLocation()), duration));
            }
            if (jobs.size() > MAX_LISTED_JOBS) {
                parts.add("  ... and " + (jobs.size() - MAX_LISTED_JOBS) + " more jobs");
            }
        }

        if (!resources.isEmpty()) {
            parts.add("\n## Resources");
            for (Resource resource : resources) {
                String name = resource.getName() != null ? resource.getName() : "unknown";
                parts.add("- " + name + ": capacity=" + resource.getCapacity());
            }
        }
    }

    private void appendSolution(List<String> parts, VrpSolution solution) {
        parts.add("\n## Solution");
        parts.add("- Solution ID: " + (solution.getId() != null ? solution.getId() : "N/A"));
        parts.add("- Status: " + (solution.getStatus() != null ? solution.getStatus() : "SOLVED"));
        parts.add("- Routes Generated: " + solution.getTrips().size());
        parts.add("- Unserved Jobs: " + solution.getUnserved().size());

        if (solution.getOccupancy() != null) {
            parts.add(String.format(Locale.ROOT, "- Overall Occupancy: %.1f%%", solution.getOccupancy() * 100));
        }
        Long meters = solution.getTotalTravelDistanceInMeters();
        if (meters != null && meters > 0) {
            parts.add(String.format(Locale.ROOT, "- Total Distance: %.1f km", meters / 1000.0));
        }
        Long seconds = solution.getTotalTravelTimeInSeconds();
        if (seconds != null && seconds > 0) {
            parts.add(String.format(Locale.ROOT, "- Total Travel Time: %.1f hours", seconds / 3600.0));
        }

        List<Trip> trips = solution.getTrips();
        if (!trips.isEmpty()) {
            parts.add("\n## Route Details");
            for (int idx = 0; idx < trips.size(); idx++) {
                Trip trip = trips.get(idx);
                String resource = trip.getResource() != null ? trip.getResource() : "vehicle_" + idx;
                long travelTime = trip.getTravelTime() == null ? 0 : trip.getTravelTime();
                parts.add(String.format(Locale.ROOT, "- %s: %d stops, %.1f km, %.0f min travel time",
                        resource, trip.stopCount(), trip.distanceOrZero() / 1000.0, travelTime / 60.0));
            }
        }

        Score score = solution.getScore();
        if (score != null) {
            parts.add("\n## Solution Quality");
            if (score.getFeasible() != null) {
                parts.add("- Feasible: " + score.getFeasible());
            }
            if (score.getHardScore() != null) {
                parts.add("- Hard Score: " + score.getHardScore());
            }
            if (score.getSoftScore() != null) {
                parts.add("- Soft Score: " + score.getSoftScore());
            }
        }

        List<SolutionViolation> violations = solution.getViolations();
        if (!violations.isEmpty()) {
            parts.add("\n## Constraint Violations");
            violations.stream()
                    .limit(MAX_LISTED_VIOLATIONS)
                    .filter(v -> v.getName() != null && v.getValue() != null)
                    .forEach(v -> parts.add("- " + v.getName() + " (" + v.getLevel() + "): " + v.getValue()));
        }
    }

    private static String describe(Location location) {
        if (location == null) return "Unknown location";
        if (location.hasCoordinates()) {
            return String.format(Locale.ROOT, "(%.4f, %.4f)", location.getLatitude(), location.getLongitude());
        }
        return location.getAddress() != null ? location.getAddress() : "Unknown location";
    }
}
