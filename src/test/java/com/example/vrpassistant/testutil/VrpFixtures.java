package com.example.vrpassistant.testutil;

import com.example.vrpassistant.model.Job;
import com.example.vrpassistant.model.Location;
import com.example.vrpassistant.model.Resource;
import com.example.vrpassistant.model.TimeWindow;
import com.example.vrpassistant.model.Trip;
import com.example.vrpassistant.model.Visit;
import com.example.vrpassistant.model.VrpProblem;
import com.example.vrpassistant.model.VrpSolution;

import java.util.Arrays;
import java.util.stream.IntStream;

public final class VrpFixtures {

    private VrpFixtures() {
    }

    public static Job job(String name, int windowCount) {
        Job.JobBuilder job = Job.builder()
                .name(name)
                .duration(600)
                .location(Location.builder().latitude(51.05).longitude(3.73).build());
        for (int i = 0; i < windowCount; i++) {
            job.window(TimeWindow.builder()
                    .from(String.format("2024-01-01T%02d:00:00Z", 8 + i))
                    .to(String.format("2024-01-01T%02d:30:00Z", 8 + i))
                    .build());
        }
        return job.build();
    }

    public static Resource resource(String name, Integer... capacity) {
        return Resource.builder()
                .name(name)
                .capacity(Arrays.asList(capacity))
                .build();
    }

    public static VrpProblem problem(int jobCount, int resourceCount) {
        VrpProblem.VrpProblemBuilder problem = VrpProblem.builder();
        IntStream.range(0, jobCount).forEach(i -> problem.job(job("job-" + i, 1)));
        IntStream.range(0, resourceCount).forEach(i -> problem.resource(resource("van-" + i, 100)));
        return problem.build();
    }

    public static Trip trip(String resource, Long distance, Long duration, String... jobs) {
        Trip.TripBuilder trip = Trip.builder()
                .resource(resource)
                .distance(distance)
                .duration(duration);
        for (String job : jobs) {
            trip.visit(Visit.builder().job(job).build());
        }
        return trip.build();
    }

    public static VrpSolution solution(Trip... trips) {
        return VrpSolution.builder()
                .id("sol-1")
                .status("SOLVED")
                .trips(Arrays.asList(trips))
                .build();
    }
}
