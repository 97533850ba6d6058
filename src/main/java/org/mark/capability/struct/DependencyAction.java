package org.mark.capability.struct;

/**
 * 	依赖规则命中后的动作。
 */
public enum DependencyAction {
	/**
	 * 	在界面上隐藏受影响的参数
	 */
	HIDE,
	/**
	 * 	显示警告
	 */
	SHOW_WARNING,
	/**
	 * 	强制设置为某个值
	 */
	FORCE_VALUE
}
