package com.rapidlayout;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

public class LayoutParams {

    // Coordinate domain of every corner variable
    private long coordMin = 0;
    private long coordMax = 10000;

    // Solver Parameters
    private double timeLimitSec = 60.0;
    private int numWorkers = 8;
    private int randomSeed = 999;
    private boolean logSearchProgress = false;

    // Default footprint of leaves nothing else constrains
    private boolean defaultFootprint = true;
    private long defaultLeafWidth = 10;
    private long defaultLeafHeight = 10;

    private boolean verbose = false;

    private static class ParamsJson {
        public Long coordMin;
        public Long coordMax;

        public Double timeLimitSec;
        public Integer numWorkers;
        public Integer randomSeed;
        public Boolean logSearchProgress;

        public Boolean defaultFootprint;
        public Long defaultLeafWidth;
        public Long defaultLeafHeight;

        public Boolean verbose;
    }

    public LayoutParams() {
    }

    public LayoutParams(Path jsonFilePath) {
        try (FileReader reader = new FileReader(jsonFilePath.toFile())) {
            loadJson(reader, jsonFilePath.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Fail to read layout parameters from " + jsonFilePath, e);
        }
    }

    public static LayoutParams fromJson(Reader reader) {
        LayoutParams params = new LayoutParams();
        params.loadJson(reader, "<reader>");
        return params;
    }

    private void loadJson(Reader reader, String source) {
        Gson gson = new GsonBuilder().create();
        ParamsJson params;
        try {
            params = gson.fromJson(reader, ParamsJson.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed layout parameters in " + source, e);
        }
        if (params == null) {
            return;
        }

        if (params.coordMin != null) {
            coordMin = params.coordMin;
        }
        if (params.coordMax != null) {
            coordMax = params.coordMax;
        }
        if (params.timeLimitSec != null) {
            setTimeLimitSec(params.timeLimitSec);
        }
        if (params.numWorkers != null) {
            setNumWorkers(params.numWorkers);
        }
        if (params.randomSeed != null) {
            randomSeed = params.randomSeed;
        }
        if (params.logSearchProgress != null) {
            logSearchProgress = params.logSearchProgress;
        }
        if (params.defaultFootprint != null) {
            defaultFootprint = params.defaultFootprint;
        }
        if (params.defaultLeafWidth != null) {
            defaultLeafWidth = params.defaultLeafWidth;
        }
        if (params.defaultLeafHeight != null) {
            defaultLeafHeight = params.defaultLeafHeight;
        }
        if (params.verbose != null) {
            verbose = params.verbose;
        }

        setCoordRange(coordMin, coordMax);
        setDefaultLeafSize(defaultLeafWidth, defaultLeafHeight);
    }

    // setters
    // boxes store int corners, so the domain must fit in an int
    public LayoutParams setCoordRange(long min, long max) {
        if (min < Integer.MIN_VALUE || max > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                String.format("Coordinate range [%d, %d] exceeds the int range of cell boxes", min, max));
        }
        if (max - min < 1) {
            throw new IllegalArgumentException(
                String.format("Coordinate range [%d, %d] cannot hold a cell of positive size", min, max));
        }
        this.coordMin = min;
        this.coordMax = max;
        return this;
    }

    public LayoutParams setTimeLimitSec(double timeLimitSec) {
        if (!(timeLimitSec > 0)) {
            throw new IllegalArgumentException("timeLimitSec should be positive: " + timeLimitSec);
        }
        this.timeLimitSec = timeLimitSec;
        return this;
    }

    public LayoutParams setNumWorkers(int numWorkers) {
        if (numWorkers < 0) {
            throw new IllegalArgumentException("numWorkers should not be negative: " + numWorkers);
        }
        this.numWorkers = numWorkers;
        return this;
    }

    public LayoutParams setRandomSeed(int randomSeed) {
        this.randomSeed = randomSeed;
        return this;
    }

    public LayoutParams setLogSearchProgress(boolean logSearchProgress) {
        this.logSearchProgress = logSearchProgress;
        return this;
    }

    public LayoutParams setDefaultFootprint(boolean defaultFootprint) {
        this.defaultFootprint = defaultFootprint;
        return this;
    }

    public LayoutParams setDefaultLeafSize(long width, long height) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException(
                String.format("Default leaf size should be positive: %dx%d", width, height));
        }
        this.defaultLeafWidth = width;
        this.defaultLeafHeight = height;
        return this;
    }

    public LayoutParams setVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    // getters
    public long getCoordMin() {
        return coordMin;
    }

    public long getCoordMax() {
        return coordMax;
    }

    public double getTimeLimitSec() {
        return timeLimitSec;
    }

    public int getNumWorkers() {
        return numWorkers;
    }

    public int getRandomSeed() {
        return randomSeed;
    }

    public boolean isLogSearchProgress() {
        return logSearchProgress;
    }

    public boolean isDefaultFootprint() {
        return defaultFootprint;
    }

    public long getDefaultLeafWidth() {
        return defaultLeafWidth;
    }

    public long getDefaultLeafHeight() {
        return defaultLeafHeight;
    }

    public boolean isVerbose() {
        return verbose;
    }

    @Override
    public String toString() {
        return String.format(
            "LayoutParams(coord=[%d, %d], timeLimit=%.1fs, workers=%d, seed=%d, footprint=%b %dx%d)",
            coordMin, coordMax, timeLimitSec, numWorkers, randomSeed,
            defaultFootprint, defaultLeafWidth, defaultLeafHeight);
    }
}
