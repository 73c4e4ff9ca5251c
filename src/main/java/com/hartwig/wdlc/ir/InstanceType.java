package com.hartwig.wdlc.ir;

/**
 * Specification of the instance type an applet runs on.
 * <ul>
 *     <li>Default: the platform default, useful for auxiliary calculations.</li>
 *     <li>Const: known at compile time, the job is started directly on the correct instance.</li>
 *     <li>Runtime: depends on expressions that can only be evaluated at runtime. The applet evaluates them, and then
 *     starts a second job on the resolved instance.</li>
 * </ul>
 */
public interface InstanceType {
    <T> T accept(Visitor<T> visitor);

    interface Visitor<T> {
        T visitDefault(DefaultInstanceType instanceType);

        T visitConst(ConstInstanceType instanceType);

        T visitRuntime(RuntimeInstanceType instanceType);
    }
}
