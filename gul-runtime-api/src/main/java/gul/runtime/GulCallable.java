package gul.runtime;

import java.util.List;

/**
 * GUL 可调用对象接口
 *
 * <p>实现类：</p>
 * <ul>
 *   <li>GulNativeFunction - 内置函数</li>
 *   <li>GulFunction - 源码中定义的函数，带定义时的环境快照</li>
 * </ul>
 */
public interface GulCallable {

    /**
     * 获取函数名称
     */
    String getName();

    /**
     * 获取参数数量
     *
     * @return 参数数量，-1 表示可变参数
     */
    default int getArity() {
        return -1;
    }

    /**
     * 调用函数。缺少的参数由实现决定如何补齐，多余的参数被忽略。
     */
    GulValue call(List<GulValue> args);
}
