package gpulane.coordinator.execution;

@FunctionalInterface
public interface ProgressListener {

    void onProgress(int percent, String stage);
}
