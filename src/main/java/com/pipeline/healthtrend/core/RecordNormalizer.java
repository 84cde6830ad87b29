package com.pipeline.healthtrend.core;

import com.pipeline.healthtrend.model.MetricSample;
import com.pipeline.healthtrend.model.NormalizationResult;
import com.pipeline.healthtrend.model.SchemaDescriptor;

import java.util.List;
import java.util.Map;

/**
 * 记录归一化器接口 —— 原始上传记录进入管道的唯一入口。
 *
 * 将字段名到任意值的原始映射，按模式描述校验并规范化为类型化的 MetricSample。
 * 归一化是纯函数：不读写任何外部状态，时间判断只依赖注入的时钟。
 *
 * 校验规则：
 *   - metric_name / timestamp / value 缺失即拒绝
 *   - 数字字符串转换为浮点数，非数字内容拒绝
 *   - 时间戳超出保留窗口（过旧或未来时间）拒绝
 *   - 模式未声明的字段忽略，不拒绝
 */
public interface RecordNormalizer {

    /**
     * 归一化单条记录。
     *
     * @param rawRecord 原始记录
     * @param schema    模式描述
     * @return 归一化后的样本
     * @throws com.pipeline.healthtrend.exception.RecordValidationException 记录不合规时抛出
     */
    MetricSample normalize(Map<String, Object> rawRecord, SchemaDescriptor schema);

    /**
     * 批量归一化。
     * 不合规记录被收集而非抛出，单条坏记录不会中断整批。
     * 实现可以将记录分块并行处理，但结果必须保持输入顺序。
     *
     * @param rawRecords 原始记录批次
     * @param schema     模式描述
     * @return 合规样本与错误条目
     */
    NormalizationResult normalizeBatch(List<Map<String, Object>> rawRecords, SchemaDescriptor schema);
}
