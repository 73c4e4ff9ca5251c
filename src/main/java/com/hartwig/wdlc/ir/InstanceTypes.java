package com.hartwig.wdlc.ir;

public final class InstanceTypes {

    private InstanceTypes() {
    }

    /**
     * Picks the instance type strategy for a set of requirements. A single runtime expression forces the two stage
     * dispatch, even if the other requirements are constant.
     */
    public static InstanceType select(ResourceRequirements requirements) {
        if (requirements.hasRuntimeExpressions()) {
            return RuntimeInstanceType.instance();
        }
        if (requirements.instanceClass().isEmpty() && requirements.memoryMB().isEmpty() && requirements.diskGB().isEmpty()
                && requirements.cpu().isEmpty()) {
            return DefaultInstanceType.instance();
        }
        return ConstInstanceType.builder()
                .instanceClass(requirements.instanceClass())
                .memoryMB(requirements.memoryMB())
                .diskGB(requirements.diskGB())
                .cpu(requirements.cpu())
                .build();
    }
}
