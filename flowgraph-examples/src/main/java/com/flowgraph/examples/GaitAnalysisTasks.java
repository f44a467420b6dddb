package com.flowgraph.examples;

import com.flowgraph.annotations.TaskFunction;
import com.flowgraph.annotations.TaskInput;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Task functions for the gait analysis example. Each step derives its output file names from
 * the previous step's outputs; nothing touches the file system.
 */
public final class GaitAnalysisTasks {

    @TaskFunction(value = "setup", description = "Initialize file paths for the subject and trial")
    public Map<String, Object> setupPaths(@TaskInput("projectFolder") String projectFolder,
                                          @TaskInput("subjectName") String subjectName,
                                          @TaskInput("trialName") String trialName) {
        Map<String, Object> paths = new LinkedHashMap<>();
        paths.put("modelPath", projectFolder + "/models/" + subjectName + "_scaled.osim");
        paths.put("markersPath", projectFolder + "/data/" + subjectName + "/" + trialName + "/markers.trc");
        paths.put("outputFolder", projectFolder + "/results/" + subjectName + "/" + trialName);
        return paths;
    }

    @TaskFunction(value = "ik", description = "Calculate joint angles from marker data")
    public Map<String, Object> inverseKinematics(@TaskInput("modelPath") String modelPath,
                                                 @TaskInput("markersPath") String markersPath,
                                                 @TaskInput("outputFolder") String outputFolder) {
        return Map.of("ikOutput", outputFolder + "/IK.mot");
    }

    @TaskFunction(value = "id", description = "Calculate joint moments and forces")
    public Map<String, Object> inverseDynamics(@TaskInput("ikOutput") String ikOutput,
                                               @TaskInput("outputFolder") String outputFolder) {
        return Map.of("idOutput", outputFolder + "/ID.sto");
    }

    @TaskFunction(value = "so", description = "Estimate muscle forces")
    public Map<String, Object> staticOptimization(@TaskInput("ikOutput") String ikOutput,
                                                  @TaskInput("outputFolder") String outputFolder,
                                                  @TaskInput(value = "maxIterations", defaultValue = "100") int maxIterations) {
        return Map.of("soOutput", outputFolder + "/SO", "soIterations", maxIterations);
    }

    @TaskFunction(value = "jra", description = "Calculate joint reaction forces")
    public Map<String, Object> jointReactionAnalysis(@TaskInput("soOutput") String soOutput,
                                                     @TaskInput("outputFolder") String outputFolder) {
        return Map.of("jraOutput", outputFolder + "/JRA.sto");
    }

    @TaskFunction(value = "report", description = "Create analysis summary report")
    public Map<String, Object> generateReport(@TaskInput("subjectName") String subjectName,
                                              @TaskInput("trialName") String trialName,
                                              @TaskInput("jraOutput") String jraOutput) {
        String summary = "Analysis Report | subject=" + subjectName + " | trial=" + trialName + " | jra=" + jraOutput;
        return Map.of("reportSummary", summary);
    }
}
