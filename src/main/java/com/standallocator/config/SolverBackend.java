package com.standallocator.config;

import com.standallocator.solver.engine.SolverAdapter;
import com.standallocator.solver.engine.cpsat.CpSatSolverAdapter;
import com.standallocator.solver.engine.timefold.TimefoldSolverAdapter;

/**
 * Available solver adapters.
 */
public enum SolverBackend {
    CP_SAT {
        @Override
        public SolverAdapter createAdapter(SolverSettings settings) {
            return new CpSatSolverAdapter(settings.getTimeLimitSeconds(), settings.getWorkers());
        }
    },
    TIMEFOLD {
        @Override
        public SolverAdapter createAdapter(SolverSettings settings) {
            return new TimefoldSolverAdapter(settings.getTimeLimitSeconds(), settings.getUnimprovedSeconds());
        }
    };

    public abstract SolverAdapter createAdapter(SolverSettings settings);
}
