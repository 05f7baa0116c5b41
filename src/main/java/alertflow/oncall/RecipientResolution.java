package alertflow.oncall;

import lombok.Data;

import java.util.Collections;
import java.util.Set;

/**
 * 接收人解析结果,noCoverage 表示开启值班但当前无人值班
 */
@Data
public class RecipientResolution {
    private final Set<Recipient> recipients;
    private final boolean noCoverage;

    public static RecipientResolution of(Set<Recipient> recipients) {
        return new RecipientResolution(recipients, false);
    }

    public static RecipientResolution noCoverage() {
        return new RecipientResolution(Collections.emptySet(), true);
    }
}
