package me.golemcore.forum.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */


import me.golemcore.forum.domain.service.ForumTrees;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A call marker: records that an agent was invoked at this point of a
 * conversation. The content holds the receiving agent's alias and the sender
 * alias is always empty.
 */
public class AgentCallMsg extends Message {

    public static final String MODEL = "call";

    public static final String FUNCTION_KWARGS = "function_kwargs";
    public static final String MSG_SEQ_START_HASH_KEY = "msg_seq_start_hash_key";

    private static final Set<String> CALL_FIELDS = Set.of(
            MODEL_FIELD, CONTENT, SENDER_ALIAS, PREV_MSG_HASH_KEY, FUNCTION_KWARGS, MSG_SEQ_START_HASH_KEY);

    public AgentCallMsg(ForumTrees forumTrees, String receiverAlias, String prevMsgHashKey,
            Freeform functionKwargs, String msgSeqStartHashKey) {
        super(forumTrees, messageFields(MODEL, receiverAlias, "", prevMsgHashKey,
                callFields(functionKwargs, msgSeqStartHashKey), Map.of()), null);
    }

    private static Map<String, Object> callFields(Freeform functionKwargs, String msgSeqStartHashKey) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(FUNCTION_KWARGS, functionKwargs != null ? functionKwargs : Freeform.empty());
        fields.put(MSG_SEQ_START_HASH_KEY, msgSeqStartHashKey);
        return fields;
    }

    public String getReceiverAlias() {
        return getContent();
    }

    public Freeform getFunctionKwargs() {
        return (Freeform) getField(FUNCTION_KWARGS);
    }

    public String getMsgSeqStartHashKey() {
        return (String) getField(MSG_SEQ_START_HASH_KEY);
    }

    @Override
    protected Set<String> messageFieldNames() {
        return CALL_FIELDS;
    }
}
